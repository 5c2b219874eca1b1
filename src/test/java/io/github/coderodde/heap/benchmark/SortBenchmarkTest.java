package io.github.coderodde.heap.benchmark;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Map;
import java.util.Random;
import org.junit.Test;
import static org.junit.Assert.*;

public class SortBenchmarkTest {
    
    @Test
    public void everySorterPassesVerification() {
        Random random = new Random(1L);
        int[] data = DataDistribution.FEW_UNIQUE.generate(2_000, random);
        
        for (Map.Entry<String, Sorter> e : 
                SortBenchmark.sorters(random).entrySet()) {
            
            double millis = SortBenchmark.medianMillis(e.getKey(), 
                                                       e.getValue(),
                                                       data,
                                                       3);
            assertTrue(millis >= 0.0);
        }
    }
    
    @Test
    public void wrongOutputIsReported() {
        Sorter broken = input -> input;
        int[] data = DataDistribution.REVERSE.generate(10, new Random());
        
        try {
            SortBenchmark.medianMillis("Identity", broken, data, 1);
            fail("Expected an IllegalStateException.");
        } catch (IllegalStateException ex) {
            assertTrue(ex.getMessage().startsWith("Identity"));
        }
    }
    
    @Test
    public void benchmarkDoesNotModifyInput() {
        int[] data = DataDistribution.REVERSE.generate(50, new Random());
        int[] copy = data.clone();
        
        SortBenchmark.medianMillis("Heapsort", 
                                   SortBenchmark.sorters(new Random())
                                                .get("Heapsort"),
                                   data, 
                                   2);
        
        assertArrayEquals(copy, data);
    }
    
    @Test
    public void distributionsHaveExpectedShape() {
        Random random = new Random(2L);
        
        assertArrayEquals(new int[]{ 0, 1, 2, 3 }, 
                          DataDistribution.SORTED.generate(4, random));
        assertArrayEquals(new int[]{ 4, 3, 2, 1 }, 
                          DataDistribution.REVERSE.generate(4, random));
        
        for (int value : DataDistribution.FEW_UNIQUE.generate(500, random)) {
            assertTrue(value >= 0 && value <= 10);
        }
        
        for (int value : DataDistribution.RANDOM.generate(500, random)) {
            assertTrue(value >= 0 && value <= 500);
        }
    }
    
    @Test(expected = IllegalArgumentException.class)
    public void rejectsNegativeSize() {
        DataDistribution.SORTED.generate(-1, new Random());
    }
    
    @Test
    public void mainPrintsSeedInHeader() {
        PrintStream stdout = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        
        try {
            System.setOut(new PrintStream(captured, true));
            SortBenchmark.main(new String[]{ "10", "100" });
        } finally {
            System.setOut(stdout);
        }
        
        String firstLine = captured.toString().split("\\R", 2)[0];
        
        assertTrue(firstLine, firstLine.matches(
                "Median time \\(ms\\) over 7 trials, seed -?\\d+"));
    }
}
