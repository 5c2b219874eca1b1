package io.github.coderodde.heap.benchmark;

import io.github.coderodde.heap.HeapSort;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares the running time of heapsort against quicksort and merge sort on
 * several input distributions. Usage:
 *
 * <pre>
 *   SortBenchmark [size1 size2 ...]
 * </pre>
 *
 * @author Rodion "rodde" Efremov
 * @version 1.0.0
 * @since 1.0.0
 */
public class SortBenchmark {

    private static final Logger LOGGER =
            LoggerFactory.getLogger(SortBenchmark.class);

    static final int[] DEFAULT_SIZES = { 1_000, 5_000, 10_000, 20_000 };
    static final int TRIALS = 7;

    public static void main(String[] args) {
        int[] sizes = args.length > 0 ? parseSizes(args) : DEFAULT_SIZES;
        long seed = System.nanoTime();
        Random random = new Random(seed);

        LOGGER.info("Benchmarking sizes {} with seed {}.",
                    Arrays.toString(sizes),
                    seed);

        Map<String, Sorter> sorters = sorters(random);

        System.out.println("Median time (ms) over " 
                + TRIALS 
                + " trials, seed " 
                + seed);
        System.out.println();

        for (DataDistribution distribution : DataDistribution.values()) {
            System.out.println("=== Data distribution: "
                    + distribution.name().toLowerCase()
                    + " ===");

            for (int n : sizes) {
                int[] data = distribution.generate(n, random);
                StringBuilder row =
                        new StringBuilder(String.format("n=%6d", n));

                for (Map.Entry<String, Sorter> e : sorters.entrySet()) {
                    double millis = medianMillis(e.getKey(),
                                                 e.getValue(),
                                                 data,
                                                 TRIALS);

                    row.append(String.format(" | %s: %8.2f",
                                             e.getKey(),
                                             millis));
                }

                System.out.println(row);
            }

            System.out.println();
        }
    }

    static Map<String, Sorter> sorters(Random random) {
        Map<String, Sorter> sorters = new LinkedHashMap<>();

        sorters.put("Heapsort", input -> {
            HeapSort.sort(input);
            return input;
        });

        sorters.put("Quicksort (rand)", input -> {
            QuickSort.sort(input, random);
            return input;
        });

        sorters.put("Merge Sort", MergeSort::sort);
        return sorters;
    }

    /**
     * Runs {@code sorter} on a fresh copy of {@code data} {@code trials}
     * times and returns the median running time.
     *
     * @param name   the name of the sorter, used in error messages.
     * @param sorter the sorting routine.
     * @param data   the input. Never modified.
     * @param trials the number of runs.
     * @return the median running time in milliseconds.
     * @throws IllegalStateException if the sorter produces a wrong result.
     */
    public static double medianMillis(String name,
                                      Sorter sorter,
                                      int[] data,
                                      int trials) {
        Objects.requireNonNull(sorter, "The sorter is null.");
        Objects.requireNonNull(data,   "The input data is null.");

        if (trials < 1) {
            throw new IllegalArgumentException(
                    "The number of trials must be positive: " + trials);
        }

        int[] expected = data.clone();
        Arrays.sort(expected);

        double[] times = new double[trials];

        for (int trial = 0; trial < trials; ++trial) {
            int[] input = data.clone();

            long start = System.nanoTime();
            int[] output = sorter.sort(input);
            long end = System.nanoTime();

            if (!Arrays.equals(expected, output)) {
                throw new IllegalStateException(
                        name + " produced incorrect output.");
            }

            times[trial] = (end - start) / 1_000_000.0;
        }

        Arrays.sort(times);

        return trials % 2 == 1
                ? times[trials / 2]
                : (times[trials / 2 - 1] + times[trials / 2]) / 2.0;
    }

    private static int[] parseSizes(String[] args) {
        int[] sizes = new int[args.length];

        for (int i = 0; i < args.length; ++i) {
            try {
                sizes[i] = Integer.parseInt(args[i]);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException(
                        "Not a valid size: \"" + args[i] + "\"", ex);
            }

            if (sizes[i] < 0) {
                throw new IllegalArgumentException(
                        "Negative size: " + sizes[i]);
            }
        }

        return sizes;
    }
}
