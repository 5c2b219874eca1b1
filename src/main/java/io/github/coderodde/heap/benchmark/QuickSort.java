package io.github.coderodde.heap.benchmark;

import java.util.Objects;
import java.util.Random;

/**
 * This class implements a randomized quicksort with three-way partitioning.
 * Runs of keys equal to the pivot are excluded from both recursive calls, so
 * inputs with few distinct keys sort fast.
 */
public final class QuickSort {
    
    private QuickSort() {
        
    }
    
    public static void sort(int[] array) {
        sort(array, new Random());
    }
    
    public static void sort(int[] array, Random random) {
        Objects.requireNonNull(array,  "The input array is null.");
        Objects.requireNonNull(random, "The random source is null.");
        sort(array, 0, array.length - 1, random);
    }
    
    private static void sort(int[] a, int lo, int hi, Random random) {
        while (lo < hi) {
            int pivot = a[lo + random.nextInt(hi - lo + 1)];
            
            // a[lo..lt-1] < pivot, a[lt..i-1] == pivot, a[gt+1..hi] > pivot
            int lt = lo;
            int i  = lo;
            int gt = hi;
            
            while (i <= gt) {
                if (a[i] < pivot) {
                    swap(a, lt++, i++);
                } else if (a[i] > pivot) {
                    swap(a, i, gt--);
                } else {
                    ++i;
                }
            }
            
            // Recurse into the smaller side to keep the stack logarithmic.
            if (lt - lo < hi - gt) {
                sort(a, lo, lt - 1, random);
                lo = gt + 1;
            } else {
                sort(a, gt + 1, hi, random);
                hi = lt - 1;
            }
        }
    }
    
    private static void swap(int[] a, int i, int j) {
        int tmp = a[i];
        a[i] = a[j];
        a[j] = tmp;
    }
}
