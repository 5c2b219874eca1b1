package io.github.coderodde.heap.benchmark;

import java.util.Random;

/**
 * Input shapes used for benchmarking the sorting algorithms.
 */
public enum DataDistribution {
    
    /** Uniform keys from {@code [0, n]}. */
    RANDOM {
        @Override
        public int[] generate(int n, Random random) {
            int[] data = new int[checkSize(n)];
            
            for (int i = 0; i < n; ++i) {
                data[i] = random.nextInt(n + 1);
            }
            
            return data;
        }
    },
    
    /** {@code 0, 1, ..., n - 1}. */
    SORTED {
        @Override
        public int[] generate(int n, Random random) {
            int[] data = new int[checkSize(n)];
            
            for (int i = 0; i < n; ++i) {
                data[i] = i;
            }
            
            return data;
        }
    },
    
    /** {@code n, n - 1, ..., 1}. */
    REVERSE {
        @Override
        public int[] generate(int n, Random random) {
            int[] data = new int[checkSize(n)];
            
            for (int i = 0; i < n; ++i) {
                data[i] = n - i;
            }
            
            return data;
        }
    },
    
    /** Uniform keys from {@code [0, 10]}. */
    FEW_UNIQUE {
        @Override
        public int[] generate(int n, Random random) {
            int[] data = new int[checkSize(n)];
            
            for (int i = 0; i < n; ++i) {
                data[i] = random.nextInt(MAXIMUM_FEW_UNIQUE_KEY + 1);
            }
            
            return data;
        }
    };
    
    static final int MAXIMUM_FEW_UNIQUE_KEY = 10;
    
    public abstract int[] generate(int n, Random random);
    
    private static int checkSize(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Negative data size: " + n);
        }
        
        return n;
    }
}
