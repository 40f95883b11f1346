package jweighted.random;

import cern.jet.random.engine.MersenneTwister;
import cern.jet.random.engine.RandomEngine;

import jweighted.util.WeightUtils;

/**
 * Seeded Mersenne Twister plus a uniform integer distribution over
 * {@code [1, bound]}. An engine created without a seed cannot draw until
 * {@link #seed(int)} is called.
 * 
 * <p>Values are drawn from the generator's raw 32-bit output by rejection,
 * so every integer in the range is exactly equally likely for any bound up
 * to {@link WeightUtils#MAX_WEIGHT}.
 */
public class RandomSelectionEngine
{
	private static final long RAW_RANGE = 1L << 32;
	
	RandomEngine rng;
	long bound;
	
	// Raw values at or above this are rejected; a multiple of bound
	long acceptLimit;
	
	public RandomSelectionEngine()
	{
	}
	
	public RandomSelectionEngine(int seed)
	{
		seed(seed);
	}
	
	public void seed(int seed)
	{
		rng = new MersenneTwister(seed);
	}
	
	public boolean isSeeded()
	{
		return rng != null;
	}
	
	public long getBound()
	{
		return bound;
	}
	
	/**
	 * Sets the upper end of the distribution. Zero means there is nothing
	 * to draw from.
	 */
	public void setBound(long bound)
	{
		if(bound < 0) throw new IllegalArgumentException("Bound must not be negative.");
		if(bound > WeightUtils.MAX_WEIGHT)
			throw new IllegalArgumentException("Bound exceeds " + WeightUtils.MAX_WEIGHT + ": " + bound);
		
		this.bound = bound;
		this.acceptLimit = bound == 0 ? 0 : RAW_RANGE - RAW_RANGE % bound;
	}
	
	public long nextValue()
	{
		if(rng == null)
			throw new IllegalStateException("Engine has not been seeded.");
		if(bound == 0)
			throw new IllegalStateException("Distribution has no range.");
		
		boolean accepted = false;
		long raw = 0;
		while(!accepted)
		{
			raw = rng.nextInt() & 0xFFFFFFFFL;
			accepted = raw < acceptLimit;
		}
		return 1 + raw % bound;
	}
	
	/**
	 * Draws one integer and resolves it through the index. Returns null if
	 * the index is empty.
	 */
	public <E> E draw(CumulativeRangeIndex<E> index)
	{
		if(index.isEmpty()) return null;
		
		if(index.getTotalWeight() != bound)
		{
			throw new IllegalStateException(String.format(
				"Index total %d does not match distribution bound %d", index.getTotalWeight(), bound));
		}
		
		E value = index.resolve(nextValue());
		assert value != null;
		return value;
	}
}
