package jweighted.random;

import java.util.*;

import jweighted.util.WeightUtils;

/**
 * Immutable mapping from {@code [1, totalWeight]} to elements, derived from
 * a snapshot of element weights. Elements are laid out in the iteration
 * order of the map they are built from; each one owns a contiguous range
 * whose length is its weight.
 * 
 * <p>Lookups use binary search over the upper bounds of the non-empty
 * ranges. Indexes with at most {@code linearScanThreshold} non-empty ranges
 * are scanned linearly instead.
 * 
 * @param <E> element type
 */
public class CumulativeRangeIndex<E>
{
	private final List<CumulativeRange<E>> ranges;
	private final long totalWeight;
	private final int linearScanThreshold;
	
	// Non-empty ranges only, in order; upperBounds is strictly increasing.
	private final List<E> drawable;
	private final long[] upperBounds;
	
	public static <E> CumulativeRangeIndex<E> empty()
	{
		return new CumulativeRangeIndex<E>(new TreeMap<E, Long>(), 0);
	}
	
	public CumulativeRangeIndex(SortedMap<E, Long> weights, int linearScanThreshold)
	{
		if(linearScanThreshold < 0)
			throw new IllegalArgumentException("Linear scan threshold must not be negative.");
		this.linearScanThreshold = linearScanThreshold;
		
		List<CumulativeRange<E>> ranges = new ArrayList<CumulativeRange<E>>(weights.size());
		drawable = new ArrayList<E>(weights.size());
		long[] uppers = new long[weights.size()];
		
		long total = 0;
		for(Map.Entry<E, Long> entry : weights.entrySet())
		{
			long weight = entry.getValue();
			long lower = total + 1;
			total = WeightUtils.adjustTotal(total, 0, WeightUtils.checkWeight(weight));
			
			CumulativeRange<E> range = new CumulativeRange<E>(entry.getKey(), lower, total);
			ranges.add(range);
			if(!range.isEmpty())
			{
				uppers[drawable.size()] = total;
				drawable.add(entry.getKey());
			}
		}
		
		this.ranges = Collections.unmodifiableList(ranges);
		this.upperBounds = Arrays.copyOf(uppers, drawable.size());
		this.totalWeight = total;
	}
	
	public long getTotalWeight()
	{
		return totalWeight;
	}
	
	/**
	 * True when no value can be resolved, i.e. the total weight is zero.
	 */
	public boolean isEmpty()
	{
		return totalWeight == 0;
	}
	
	public List<CumulativeRange<E>> getRanges()
	{
		return ranges;
	}
	
	public CumulativeRange<E> rangeOf(E element)
	{
		for(CumulativeRange<E> range : ranges)
		{
			E candidate = range.getElement();
			if(candidate == null ? element == null : candidate.equals(element))
				return range;
		}
		return null;
	}
	
	/**
	 * Returns the element whose range contains {@code value}.
	 * 
	 * @param value an integer in {@code [1, totalWeight]}
	 */
	public E resolve(long value)
	{
		if(value < 1 || value > totalWeight)
		{
			throw new IllegalArgumentException(
				String.format("Value %d outside [1, %d]", value, totalWeight));
		}
		
		int count = drawable.size();
		if(count <= linearScanThreshold)
		{
			for(int i = 0; i < count; i++)
			{
				if(value <= upperBounds[i]) return drawable.get(i);
			}
			throw new IllegalStateException("No range contains " + value);
		}
		
		int i = Arrays.binarySearch(upperBounds, value);
		if(i < 0) i = -i - 1;
		return drawable.get(i);
	}
	
	@Override
	public int hashCode()
	{
		return ranges.hashCode();
	}
	
	@SuppressWarnings("unchecked")
	@Override
	public boolean equals(Object obj)
	{
		if(this == obj) return true;
		if(obj == null || !getClass().isInstance(obj)) return false;
		
		CumulativeRangeIndex<E> index = getClass().cast(obj);
		return totalWeight == index.totalWeight && ranges.equals(index.ranges);
	}
	
	@Override
	public String toString()
	{
		return ranges.toString();
	}
}
