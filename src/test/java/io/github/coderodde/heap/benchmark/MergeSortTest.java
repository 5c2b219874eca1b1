package io.github.coderodde.heap.benchmark;

import java.util.Arrays;
import java.util.Random;
import org.junit.Test;
import static org.junit.Assert.*;

public class MergeSortTest {
    
    @Test
    public void returnsSortedCopy() {
        int[] array = { 5, 1, 8, 3, 2, 9, 4 };
        int[] result = MergeSort.sort(array);
        
        assertArrayEquals(new int[]{ 1, 2, 3, 4, 5, 8, 9 }, result);
        assertArrayEquals(new int[]{ 5, 1, 8, 3, 2, 9, 4 }, array);
    }
    
    @Test
    public void sortsOddSizedRandomArrays() {
        Random random = new Random(23L);
        
        for (int n = 0; n < 70; ++n) {
            int[] array = DataDistribution.RANDOM.generate(n, random);
            int[] expected = array.clone();
            Arrays.sort(expected);
            
            assertArrayEquals(expected, MergeSort.sort(array));
        }
    }
}
