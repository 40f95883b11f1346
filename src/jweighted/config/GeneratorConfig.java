package jweighted.config;

import java.io.Reader;
import java.util.*;

import com.google.gson.*;

import jweighted.random.RandomWeightedObjectGenerator;
import jweighted.util.WeightUtils;

/**
 * Settings for a generator, read from JSON. Fields left out of the JSON keep
 * the defaults below.
 */
public class GeneratorConfig
{
	// Seed for the Mersenne Twister; a time-based seed is chosen when null
	Integer randomSeed = null;
	
	// If true, a draw after a mutation refreshes the index first;
	// if false, it fails until refresh() is called
	boolean autoRefresh = true;
	
	// Indexes with at most this many drawable elements are scanned linearly
	int linearScanThreshold = RandomWeightedObjectGenerator.DEFAULT_LINEAR_SCAN_THRESHOLD;
	
	// Initial elements of a String generator, inserted in key order
	Map<String, Long> weights = null;
	
	public static GeneratorConfig load(Reader reader)
	{
		GeneratorConfig config = new Gson().fromJson(reader, GeneratorConfig.class);
		if(config == null)
			throw new JsonParseException("Empty generator configuration.");
		config.validate();
		return config;
	}
	
	/**
	 * @throws IllegalArgumentException for a negative scan threshold or an
	 * invalid weight
	 * @throws jweighted.random.WeightOverflowException if the initial
	 * weights add up to more than the weight range
	 */
	public void validate()
	{
		if(linearScanThreshold < 0)
			throw new IllegalArgumentException("linearScanThreshold must not be negative: " + linearScanThreshold);
		if(weights != null)
		{
			for(Map.Entry<String, Long> entry : weights.entrySet())
			{
				if(entry.getValue() == null)
					throw new IllegalArgumentException("Missing weight for " + entry.getKey());
			}
			
			// Fail before any element is inserted
			WeightUtils.sum(weights.values());
		}
	}
	
	public String toJson()
	{
		return new GsonBuilder().setPrettyPrinting().create().toJson(this);
	}
	
	public Integer getRandomSeed()
	{
		return randomSeed;
	}
	
	public void setRandomSeed(Integer randomSeed)
	{
		this.randomSeed = randomSeed;
	}
	
	public boolean isAutoRefresh()
	{
		return autoRefresh;
	}
	
	public void setAutoRefresh(boolean autoRefresh)
	{
		this.autoRefresh = autoRefresh;
	}
	
	public int getLinearScanThreshold()
	{
		return linearScanThreshold;
	}
	
	public void setLinearScanThreshold(int linearScanThreshold)
	{
		this.linearScanThreshold = linearScanThreshold;
	}
	
	public Map<String, Long> getWeights()
	{
		return weights;
	}
	
	public void setWeights(Map<String, Long> weights)
	{
		this.weights = weights;
	}
}
