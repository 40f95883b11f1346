package jweighted.random;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import jweighted.util.WeightUtils;

public abstract class WeightedGeneratorAbstract<E> implements WeightedGenerator<E>
{
	private static final Logger logger = LogManager.getLogger(WeightedGeneratorAbstract.class);
	
	public List<E> sample(int amount)
	{
		if(amount < 0) throw new IllegalArgumentException("Sample size must not be negative: " + amount);
		if(totalWeight() == 0) return new ArrayList<E>();
		
		List<E> values = new ArrayList<E>(amount);
		for(int i = 0; i < amount; i++)
		{
			values.add(draw());
		}
		return values;
	}
	
	public Map<E, Integer> counts(int numDraws)
	{
		return WeightUtils.countValues(sample(numDraws));
	}
	
	public boolean verify(int numDraws)
	{
		if(numDraws <= 0) throw new IllegalArgumentException("Number of draws must be positive.");
		
		Map<E, Integer> counts = counts(numDraws);
		
		// Calculate SSE
		double sumSqErr = 0;
		for(E value : getWeights().keySet())
		{
			Double probability = probability(value);
			if(probability == null) continue;
			
			int count = counts.get(value) == null ? 0 : counts.get(value);
			
			double err = probability - (double)count / numDraws;
			sumSqErr += err * err;
		}
		
		logger.debug("Verify called: SSE = {}", sumSqErr);
		
		// Make sure SSE is less than an order of magnitude
		// greater than 1/numDraws
		return sumSqErr <= 6.0/numDraws;
	}
}
