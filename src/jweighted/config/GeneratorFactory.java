package jweighted.config;

import java.io.Reader;
import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import jweighted.random.RandomWeightedObjectGenerator;

public class GeneratorFactory
{
	private static final Logger logger = LogManager.getLogger(GeneratorFactory.class);
	
	/**
	 * Creates an empty generator. If the config has no seed, a time-based
	 * seed is chosen and written back to the config so it can be reported.
	 */
	public static <E extends Comparable<? super E>> RandomWeightedObjectGenerator<E> create(GeneratorConfig config)
	{
		config.validate();
		
		if(config.randomSeed == null)
		{
			config.randomSeed = (int)(new Date()).getTime();
			logger.debug("No seed configured, using {}", config.randomSeed);
		}
		
		return new RandomWeightedObjectGenerator<E>(
			config.randomSeed, config.autoRefresh, config.linearScanThreshold);
	}
	
	/**
	 * Loads a config and builds a String generator holding its initial
	 * weights, refreshed and ready to draw.
	 */
	public static RandomWeightedObjectGenerator<String> fromJson(Reader reader)
	{
		GeneratorConfig config = GeneratorConfig.load(reader);
		
		RandomWeightedObjectGenerator<String> generator = create(config);
		if(config.weights != null)
		{
			generator.insertAll(new TreeMap<String, Long>(config.weights));
		}
		generator.refresh();
		
		return generator;
	}
}
