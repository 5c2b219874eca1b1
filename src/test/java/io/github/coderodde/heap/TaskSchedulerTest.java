package io.github.coderodde.heap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.Test;
import static org.junit.Assert.*;

public class TaskSchedulerTest {
    
    private final TaskScheduler scheduler = new TaskScheduler();
    
    private static List<Task> demoTasks() {
        return List.of(new Task("A", 3,  0, 10),
                       new Task("B", 10, 1, 3),
                       new Task("C", 5,  1, 8),
                       new Task("D", 10, 2, 5),
                       new Task("E", 1,  3, 12));
    }
    
    @Test
    public void runsDemoSchedule() {
        List<Execution> trace = scheduler.run(demoTasks());
        
        assertEquals(List.of("A", "B", "D", "C", "E"), ids(trace));
        
        for (int i = 0; i < trace.size(); ++i) {
            assertEquals(i, trace.get(i).getTick());
        }
    }
    
    @Test
    public void stopsAtMaxTime() {
        List<Execution> trace = scheduler.run(demoTasks(), 2);
        
        assertEquals(List.of("A", "B", "D"), ids(trace));
        assertEquals(2, trace.get(2).getTick());
    }
    
    @Test
    public void skipsIdleTicks() {
        Task x = new Task("X", 1, 0);
        Task y = new Task("Y", 1, 100);
        
        List<Execution> trace = scheduler.run(List.of(y, x));
        
        assertEquals(List.of(new Execution(0, x), new Execution(100, y)), 
                     trace);
    }
    
    @Test
    public void emptyInputGivesEmptyTrace() {
        assertTrue(scheduler.run(Collections.emptyList()).isEmpty());
    }
    
    @Test(expected = DuplicateIdException.class)
    public void rejectsDuplicateIds() {
        scheduler.run(List.of(new Task("A", 1, 0), new Task("A", 2, 5)));
    }
    
    @Test(expected = IllegalArgumentException.class)
    public void rejectsNegativeMaxTime() {
        scheduler.run(demoTasks(), -1);
    }
    
    @Test
    public void traceRespectsPriorityAndArrival() {
        Random random = new Random(29L);
        
        for (int iteration = 0; iteration < 30; ++iteration) {
            List<Task> tasks = new ArrayList<>();
            
            for (int i = 0; i < 60; ++i) {
                tasks.add(new Task("T" + i, 
                                   random.nextInt(20), 
                                   random.nextInt(80)));
            }
            
            List<Execution> trace = scheduler.run(tasks);
            
            assertEquals(tasks.size(), trace.size());
            
            Set<String> executed = new HashSet<>();
            int previousTick = -1;
            
            for (Execution execution : trace) {
                int tick = execution.getTick();
                Task task = execution.getTask();
                
                assertTrue(tick > previousTick);
                assertTrue(tick >= task.getArrivalTime());
                assertTrue(executed.add(task.getTaskId()));
                
                for (Task other : tasks) {
                    boolean waiting = other.getArrivalTime() <= tick
                            && !executed.contains(other.getTaskId());
                    
                    if (waiting) {
                        assertTrue(other.getPriority() <= task.getPriority());
                    }
                }
                
                previousTick = tick;
            }
        }
    }
    
    private static List<String> ids(List<Execution> trace) {
        List<String> ids = new ArrayList<>();
        
        for (Execution execution : trace) {
            ids.add(execution.getTaskId());
        }
        
        return ids;
    }
}
