package io.github.coderodde.heap.benchmark;

/**
 * A sorting routine under benchmark. Implementations may sort in place and
 * return their argument, or return a new array.
 */
@FunctionalInterface
public interface Sorter {
    
    int[] sort(int[] input);
}
