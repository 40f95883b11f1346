package jweighted.random;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import jweighted.util.WeightUtils;
import jweighted.util.WeightedEntry;

/**
 * A container of unique elements, each with an unsigned integer weight, that
 * draws elements at random with probability {@code weight / totalWeight}.
 * 
 * <p>Mutators ({@link #insert}, {@link #erase}, {@link #modify},
 * {@link #clear}) only touch the stored weights. The cumulative range index
 * used for drawing is rebuilt by {@link #refresh()}, so several mutations can
 * be batched before paying for one rebuild. If a draw finds the index stale
 * it refreshes first, unless auto-refresh was turned off, in which case it
 * throws {@link IllegalStateException}.
 * 
 * <p>Elements of weight zero are members but are never drawn.
 * 
 * <p>Instances are not thread-safe.
 * 
 * @param <E> element type; ordering gives the layout of the index
 */
public class RandomWeightedObjectGenerator<E extends Comparable<? super E>>
	extends WeightedGeneratorAbstract<E>
{
	private static final Logger logger = LogManager.getLogger(RandomWeightedObjectGenerator.class);
	
	public static final int DEFAULT_LINEAR_SCAN_THRESHOLD = 8;
	
	private final TreeMap<E, Long> weights;
	private long totalWeight;
	
	private final boolean autoRefresh;
	private final int linearScanThreshold;
	
	private CumulativeRangeIndex<E> index;
	private boolean stale;
	
	private final RandomSelectionEngine engine;
	
	public RandomWeightedObjectGenerator(int seed)
	{
		this(seed, true, DEFAULT_LINEAR_SCAN_THRESHOLD);
	}
	
	public RandomWeightedObjectGenerator(int seed, boolean autoRefresh, int linearScanThreshold)
	{
		if(linearScanThreshold < 0)
			throw new IllegalArgumentException("Linear scan threshold must not be negative.");
		
		this.weights = new TreeMap<E, Long>();
		this.totalWeight = 0;
		this.autoRefresh = autoRefresh;
		this.linearScanThreshold = linearScanThreshold;
		this.index = CumulativeRangeIndex.empty();
		this.stale = false;
		this.engine = new RandomSelectionEngine(seed);
	}
	
	/**
	 * Copies elements, weights and settings only. The copy must be given a
	 * seed with {@link #seed(int)} before it can draw, and its index is
	 * rebuilt on the next refresh.
	 */
	public RandomWeightedObjectGenerator(RandomWeightedObjectGenerator<E> other)
	{
		this.weights = new TreeMap<E, Long>(other.weights);
		this.totalWeight = other.totalWeight;
		this.autoRefresh = other.autoRefresh;
		this.linearScanThreshold = other.linearScanThreshold;
		this.index = CumulativeRangeIndex.empty();
		this.stale = true;
		this.engine = new RandomSelectionEngine();
	}
	
	public void seed(int seed)
	{
		engine.seed(seed);
		logger.debug("Reseeded with {}", seed);
	}
	
	/**
	 * Rebuilds the cumulative range index from the current weights and
	 * bounds the random distribution to {@code [1, totalWeight]}.
	 */
	public void refresh()
	{
		index = new CumulativeRangeIndex<E>(weights, linearScanThreshold);
		assert index.getTotalWeight() == totalWeight;
		engine.setBound(totalWeight);
		stale = false;
		
		logger.debug("Refreshed index: {} elements, total weight {}", weights.size(), totalWeight);
	}
	
	public boolean isStale()
	{
		return stale;
	}
	
	public boolean isAutoRefresh()
	{
		return autoRefresh;
	}
	
	public int getLinearScanThreshold()
	{
		return linearScanThreshold;
	}
	
	/**
	 * The index built by the last refresh. May not reflect later mutations;
	 * see {@link #isStale()}.
	 */
	public CumulativeRangeIndex<E> getIndex()
	{
		return index;
	}
	
	public int size()
	{
		return weights.size();
	}
	
	public boolean empty()
	{
		return weights.isEmpty();
	}
	
	public long totalWeight()
	{
		return totalWeight;
	}
	
	public boolean contains(E element)
	{
		return element != null && weights.containsKey(element);
	}
	
	/**
	 * Returns the weight of the element, or null if it is not present.
	 * A null element is never present.
	 */
	public Long weight(E element)
	{
		if(element == null) return null;
		return weights.get(element);
	}
	
	/**
	 * Returns {@code weight / totalWeight} for the element, or null if it is
	 * not present or the total weight is zero.
	 */
	public Double probability(E element)
	{
		Long weight = weight(element);
		if(weight == null || totalWeight == 0) return null;
		return (double)weight / totalWeight;
	}
	
	public SortedMap<E, Long> getWeights()
	{
		return Collections.unmodifiableSortedMap(weights);
	}
	
	public List<WeightedEntry<E>> entries()
	{
		List<WeightedEntry<E>> entries = new ArrayList<WeightedEntry<E>>(weights.size());
		for(Map.Entry<E, Long> entry : weights.entrySet())
		{
			entries.add(new WeightedEntry<E>(entry.getKey(), entry.getValue()));
		}
		return entries;
	}
	
	/**
	 * Adds an element with its weight.
	 * 
	 * @return false if the element is already present
	 * @throws WeightOverflowException if the total weight would overflow
	 */
	public boolean insert(E element, long weight)
	{
		checkElement(element);
		WeightUtils.checkWeight(weight);
		
		if(weights.containsKey(element)) return false;
		
		totalWeight = WeightUtils.adjustTotal(totalWeight, 0, weight);
		weights.put(element, weight);
		stale = true;
		return true;
	}
	
	/**
	 * Inserts every entry of the map in its iteration order.
	 * 
	 * @return the number of elements that were not already present
	 * @throws WeightOverflowException on the first entry that would overflow
	 * the total weight; entries before it stay inserted
	 */
	public int insertAll(Map<? extends E, Long> entries)
	{
		int inserted = 0;
		for(Map.Entry<? extends E, Long> entry : entries.entrySet())
		{
			if(entry.getValue() == null)
				throw new IllegalArgumentException("Null weight for " + entry.getKey());
			if(insert(entry.getKey(), entry.getValue())) inserted++;
		}
		return inserted;
	}
	
	/**
	 * Removes an element.
	 * 
	 * @return its weight, or null if it was not present
	 */
	public Long erase(E element)
	{
		checkElement(element);
		
		Long weight = weights.remove(element);
		if(weight == null) return null;
		
		totalWeight = WeightUtils.adjustTotal(totalWeight, weight, 0);
		stale = true;
		return weight;
	}
	
	/**
	 * Replaces the weight of an existing element.
	 * 
	 * @return the previous weight, or null if the element is not present
	 * @throws WeightOverflowException if the total weight would overflow
	 */
	public Long modify(E element, long weight)
	{
		checkElement(element);
		WeightUtils.checkWeight(weight);
		
		Long previous = weights.get(element);
		if(previous == null) return null;
		
		totalWeight = WeightUtils.adjustTotal(totalWeight, previous, weight);
		weights.put(element, weight);
		stale = true;
		return previous;
	}
	
	public void clear()
	{
		weights.clear();
		totalWeight = 0;
		stale = true;
	}
	
	/**
	 * Draws one element.
	 * 
	 * @return the element, or null if the total weight is zero
	 */
	public E draw()
	{
		if(totalWeight == 0) return null;
		
		if(stale)
		{
			if(!autoRefresh)
				throw new IllegalStateException("Index is stale; call refresh() after modifying weights.");
			
			logger.debug("Index stale at draw, refreshing");
			refresh();
		}
		
		if(index.isEmpty()) return null;
		
		E value = engine.draw(index);
		if(value == null)
			throw new IllegalStateException("Failed to resolve a draw against a non-empty index.");
		return value;
	}
	
	private static void checkElement(Object element)
	{
		if(element == null) throw new IllegalArgumentException("Element must not be null.");
	}
	
	@Override
	public String toString()
	{
		return weights.toString();
	}
}
