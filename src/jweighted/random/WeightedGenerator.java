package jweighted.random;

import java.util.*;

public interface WeightedGenerator<E>
{
	public boolean insert(E element, long weight);
	public Long erase(E element);
	public Long modify(E element, long weight);
	public void clear();
	
	public boolean contains(E element);
	public int size();
	public boolean empty();
	public long totalWeight();
	public Long weight(E element);
	public Double probability(E element);
	
	public SortedMap<E, Long> getWeights();
	
	public void refresh();
	public void seed(int seed);
	
	public E draw();
	public List<E> sample(int amount);
	
	public Map<E, Integer> counts(int numDraws);
	public boolean verify(int numDraws);
}
