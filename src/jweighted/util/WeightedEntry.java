package jweighted.util;

/**
 * An element paired with its weight. Immutable.
 */
public class WeightedEntry<E>
{
	public final E element;
	public final long weight;
	private transient final int hash;
	
	public WeightedEntry(E element, long weight)
	{
		this.element = element;
		this.weight = weight;
		hash = (element == null ? 0 : element.hashCode() * 31) + (int)(weight ^ (weight >>> 32));
	}
	
	public E getElement()
	{
		return element;
	}
	
	public long getWeight()
	{
		return weight;
	}
	
	@Override
	public int hashCode()
	{
		return hash;
	}
	
	@SuppressWarnings("unchecked")
	@Override
	public boolean equals(Object obj)
	{
		if(this == obj) return true;
		if(obj == null || !getClass().isInstance(obj)) return false;
		
		WeightedEntry<E> entry = getClass().cast(obj);
		
		return weight == entry.weight
		&& (element == null ? entry.element == null : element.equals(entry.element));
	}
	
	@Override
	public String toString()
	{
		return String.format("(%s, %d)", element, weight);
	}
}
