package jweighted.random;

/**
 * The sub-range {@code [lower, upper]} of {@code [1, totalWeight]} assigned
 * to one element. A zero-weight element has {@code upper == lower - 1}.
 * 
 * @param <E> element type
 */
public class CumulativeRange<E>
{
	private final E element;
	private final long lower;
	private final long upper;
	
	public CumulativeRange(E element, long lower, long upper)
	{
		if(upper < lower - 1)
			throw new IllegalArgumentException(String.format("Invalid range [%d, %d]", lower, upper));
		
		this.element = element;
		this.lower = lower;
		this.upper = upper;
	}
	
	public E getElement()
	{
		return element;
	}
	
	public long getLower()
	{
		return lower;
	}
	
	public long getUpper()
	{
		return upper;
	}
	
	public long getWeight()
	{
		return upper - lower + 1;
	}
	
	public boolean isEmpty()
	{
		return upper < lower;
	}
	
	public boolean contains(long value)
	{
		return value >= lower && value <= upper;
	}
	
	@Override
	public int hashCode()
	{
		int hash = element == null ? 0 : element.hashCode();
		hash = hash * 31 + Long.hashCode(lower);
		return hash * 31 + Long.hashCode(upper);
	}
	
	@SuppressWarnings("unchecked")
	@Override
	public boolean equals(Object obj)
	{
		if(this == obj) return true;
		if(obj == null || !getClass().isInstance(obj)) return false;
		
		CumulativeRange<E> range = getClass().cast(obj);
		
		return lower == range.lower && upper == range.upper
		&& (element == null ? range.element == null : element.equals(range.element));
	}
	
	@Override
	public String toString()
	{
		return String.format("%s[%d, %d]", element, lower, upper);
	}
}
