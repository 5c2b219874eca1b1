package io.github.coderodde.heap.benchmark;

import java.util.Objects;

/**
 * This class implements an iterative, bottom-up merge sort. It does not 
 * modify its input.
 */
public final class MergeSort {
    
    private MergeSort() {
        
    }
    
    /**
     * Returns a sorted copy of {@code array}.
     * 
     * @param array the array to sort.
     * @return a new sorted array.
     */
    public static int[] sort(int[] array) {
        Objects.requireNonNull(array, "The input array is null.");
        
        int n = array.length;
        int[] source = array.clone();
        
        if (n <= 1) {
            return source;
        }
        
        int[] target = new int[n];
        
        for (int width = 1; width < n; width <<= 1) {
            for (int left = 0; left < n; left += 2 * width) {
                int mid   = Math.min(left + width, n);
                int right = Math.min(left + 2 * width, n);
                merge(source, target, left, mid, right);
            }
            
            int[] tmp = source;
            source = target;
            target = tmp;
        }
        
        return source;
    }
    
    private static void merge(int[] source, 
                              int[] target,
                              int left, 
                              int mid, 
                              int right) {
        int i = left;
        int j = mid;
        int k = left;
        
        while (i < mid && j < right) {
            target[k++] = source[i] <= source[j] ? source[i++] : source[j++];
        }
        
        while (i < mid) {
            target[k++] = source[i++];
        }
        
        while (j < right) {
            target[k++] = source[j++];
        }
    }
}
