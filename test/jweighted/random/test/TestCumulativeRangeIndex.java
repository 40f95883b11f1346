package jweighted.random.test;

import java.util.*;

import org.junit.*;

import jweighted.random.CumulativeRange;
import jweighted.random.CumulativeRangeIndex;

import static org.junit.Assert.*;

public class TestCumulativeRangeIndex
{
	TreeMap<String, Long> weights;
	
	@Before
	public void setUp()
	{
		weights = new TreeMap<String, Long>();
		weights.put("a", 3L);
		weights.put("b", 0L);
		weights.put("c", 1L);
		weights.put("d", 0L);
		weights.put("e", 5L);
		weights.put("f", 2L);
		weights.put("g", 0L);
	}
	
	@Test
	public void rangesPartitionTotal()
	{
		CumulativeRangeIndex<String> index = new CumulativeRangeIndex<String>(weights, 0);
		List<CumulativeRange<String>> ranges = index.getRanges();
		
		assertEquals(11, index.getTotalWeight());
		assertEquals(weights.size(), ranges.size());
		
		long next = 1;
		for(CumulativeRange<String> range : ranges)
		{
			assertEquals(next, range.getLower());
			assertEquals((long)weights.get(range.getElement()), range.getWeight());
			next = range.getUpper() + 1;
		}
		assertEquals(index.getTotalWeight() + 1, next);
		
		// Every value belongs to exactly one range
		for(long value = 1; value <= index.getTotalWeight(); value++)
		{
			int owners = 0;
			for(CumulativeRange<String> range : ranges)
			{
				if(range.contains(value)) owners++;
			}
			assertEquals("value " + value, 1, owners);
		}
	}
	
	@Test
	public void emptyRangesForZeroWeight()
	{
		CumulativeRangeIndex<String> index = new CumulativeRangeIndex<String>(weights, 0);
		
		CumulativeRange<String> b = index.rangeOf("b");
		assertTrue(b.isEmpty());
		assertEquals(4, b.getLower());
		assertEquals(3, b.getUpper());
		assertFalse(index.rangeOf("a").isEmpty());
		assertNull(index.rangeOf("z"));
	}
	
	@Test
	public void resolveMatchesRanges()
	{
		CumulativeRangeIndex<String> binary = new CumulativeRangeIndex<String>(weights, 0);
		CumulativeRangeIndex<String> linear = new CumulativeRangeIndex<String>(weights, 100);
		
		for(long value = 1; value <= binary.getTotalWeight(); value++)
		{
			String element = binary.resolve(value);
			assertEquals(element, linear.resolve(value));
			assertTrue(binary.rangeOf(element).contains(value));
		}
		
		assertEquals("a", binary.resolve(1));
		assertEquals("a", binary.resolve(3));
		assertEquals("c", binary.resolve(4));
		assertEquals("e", binary.resolve(5));
		assertEquals("e", binary.resolve(9));
		assertEquals("f", binary.resolve(11));
	}
	
	@Test
	public void largeIndex()
	{
		TreeMap<Integer, Long> many = new TreeMap<Integer, Long>();
		for(int i = 0; i < 1000; i++) many.put(i, (long)(i % 3));
		
		CumulativeRangeIndex<Integer> index = new CumulativeRangeIndex<Integer>(many, 8);
		assertEquals(999, index.getTotalWeight());
		
		for(CumulativeRange<Integer> range : index.getRanges())
		{
			if(range.isEmpty()) continue;
			assertEquals(range.getElement(), index.resolve(range.getLower()));
			assertEquals(range.getElement(), index.resolve(range.getUpper()));
		}
	}
	
	@Test
	public void rebuildIsEqual()
	{
		CumulativeRangeIndex<String> first = new CumulativeRangeIndex<String>(weights, 8);
		CumulativeRangeIndex<String> second = new CumulativeRangeIndex<String>(weights, 8);
		
		assertEquals(first, second);
		assertEquals(first.hashCode(), second.hashCode());
		
		weights.put("c", 2L);
		assertFalse(first.equals(new CumulativeRangeIndex<String>(weights, 8)));
	}
	
	@Test
	public void emptyIndex()
	{
		CumulativeRangeIndex<String> index = CumulativeRangeIndex.empty();
		assertTrue(index.isEmpty());
		assertTrue(index.getRanges().isEmpty());
		assertEquals(0, index.getTotalWeight());
	}
	
	@Test(expected = IllegalArgumentException.class)
	public void resolveBelowRange()
	{
		new CumulativeRangeIndex<String>(weights, 8).resolve(0);
	}
	
	@Test(expected = IllegalArgumentException.class)
	public void resolveAboveRange()
	{
		new CumulativeRangeIndex<String>(weights, 8).resolve(12);
	}
	
	@Test(expected = UnsupportedOperationException.class)
	public void rangesAreReadOnly()
	{
		new CumulativeRangeIndex<String>(weights, 8).getRanges().clear();
	}
}
