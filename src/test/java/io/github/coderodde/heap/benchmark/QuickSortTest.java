package io.github.coderodde.heap.benchmark;

import java.util.Arrays;
import java.util.Random;
import org.junit.Test;
import static org.junit.Assert.*;

public class QuickSortTest {
    
    @Test
    public void sortsEveryDistribution() {
        Random random = new Random(5L);
        
        for (DataDistribution distribution : DataDistribution.values()) {
            for (int n : new int[]{ 0, 1, 2, 17, 1000 }) {
                int[] array = distribution.generate(n, random);
                int[] expected = array.clone();
                Arrays.sort(expected);
                
                QuickSort.sort(array, random);
                
                assertArrayEquals(distribution + " n=" + n, expected, array);
            }
        }
    }
    
    @Test
    public void sortsNegativeKeys() {
        int[] array = { 0, -5, 3, -5, Integer.MIN_VALUE, Integer.MAX_VALUE };
        QuickSort.sort(array);
        assertArrayEquals(
                new int[]{ Integer.MIN_VALUE, -5, -5, 0, 3, Integer.MAX_VALUE },
                array);
    }
}
