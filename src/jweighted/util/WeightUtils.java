package jweighted.util;

import java.util.*;

import jweighted.random.WeightOverflowException;

/**
 * Arithmetic on weights. Weights are unsigned 32-bit quantities carried
 * in a {@code long}.
 */
public class WeightUtils
{
	/**
	 * Largest legal weight, and largest legal total weight.
	 */
	public static final long MAX_WEIGHT = 0xFFFFFFFFL;
	
	public static long checkWeight(long weight)
	{
		if(weight < 0)
			throw new IllegalArgumentException("Weight must not be negative: " + weight);
		if(weight > MAX_WEIGHT)
			throw new IllegalArgumentException("Weight exceeds " + MAX_WEIGHT + ": " + weight);
		return weight;
	}
	
	/**
	 * Returns {@code total - removed + added}, or throws if the result
	 * does not fit in the weight range.
	 */
	public static long adjustTotal(long total, long removed, long added)
	{
		long result = total - removed + added;
		if(result > MAX_WEIGHT)
		{
			throw new WeightOverflowException(String.format(
				"Total weight %d - %d + %d exceeds %d", total, removed, added, MAX_WEIGHT));
		}
		assert result >= 0;
		return result;
	}
	
	public static long sum(Collection<Long> weights)
	{
		long total = 0;
		for(long weight : weights)
		{
			total = adjustTotal(total, 0, checkWeight(weight));
		}
		return total;
	}
	
	public static <T> Map<T, Integer> countValues(Iterable<T> values)
	{
		Map<T, Integer> counts = new HashMap<T, Integer>();
		for(T value : values)
		{
			Integer count = counts.get(value);
			if(count == null)
			{
				counts.put(value, 1);
			}
			else
			{
				counts.put(value, count + 1);
			}
		}
		return counts;
	}
}
