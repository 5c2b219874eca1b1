package io.github.coderodde.heap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This class runs a discrete-time simulation over an
 * {@link IndexedPriorityQueue}. At each tick, every task arriving at that tick
 * is inserted into the queue, after which the highest priority task, if any,
 * is executed. At most one task executes per tick.
 */
public final class TaskScheduler {
    
    private static final Logger LOGGER = 
            LoggerFactory.getLogger(TaskScheduler.class);
    
    /**
     * Runs the simulation until every task has been executed.
     * 
     * @param tasks the tasks to schedule.
     * @return the execution trace in tick order.
     * @throws DuplicateIdException if two tasks share an ID.
     */
    public List<Execution> run(Collection<Task> tasks) {
        return run(tasks, Integer.MAX_VALUE);
    }
    
    /**
     * Runs the simulation up to and including tick {@code maxTime}. Tasks not
     * executed by then are left out of the trace.
     * 
     * @param tasks   the tasks to schedule.
     * @param maxTime the last tick to simulate.
     * @return the execution trace in tick order.
     * @throws DuplicateIdException if two tasks share an ID.
     */
    public List<Execution> run(Collection<Task> tasks, int maxTime) {
        Objects.requireNonNull(tasks, "The task collection is null.");
        
        if (maxTime < 0) {
            throw new IllegalArgumentException(
                    "The maximum time is negative: " + maxTime);
        }
        
        NavigableMap<Integer, List<Task>> arrivals = groupByArrival(tasks);
        IndexedPriorityQueue queue = new IndexedPriorityQueue();
        List<Execution> trace = new ArrayList<>(tasks.size());
        
        int tick = arrivals.isEmpty() ? 0 : arrivals.firstKey();
        
        while (tick <= maxTime) {
            List<Task> arriving = arrivals.remove(tick);
            
            if (arriving != null) {
                for (Task task : arriving) {
                    queue.insert(task);
                }
            }
            
            if (!queue.isEmpty()) {
                Task task = queue.extractMax();
                trace.add(new Execution(tick, task));
                LOGGER.debug("t={}: executed {}", tick, task);
            }
            
            if (queue.isEmpty()) {
                if (arrivals.isEmpty()) {
                    break;
                }
                
                // Nothing can run before the next arrival.
                tick = arrivals.firstKey();
            } else if (tick == Integer.MAX_VALUE) {
                break;
            } else {
                ++tick;
            }
        }
        
        LOGGER.info("Executed {} of {} tasks, {} not executed.",
                    trace.size(),
                    tasks.size(),
                    tasks.size() - trace.size());
        
        return trace;
    }
    
    private static NavigableMap<Integer, List<Task>> 
        groupByArrival(Collection<Task> tasks) {
            
        NavigableMap<Integer, List<Task>> arrivals = new TreeMap<>();
        Set<String> seenIds = new HashSet<>();
        
        for (Task task : tasks) {
            Objects.requireNonNull(task, "A task in the collection is null.");
            
            if (!seenIds.add(task.getTaskId())) {
                throw new DuplicateIdException(task.getTaskId());
            }
            
            arrivals.computeIfAbsent(task.getArrivalTime(), 
                                     k -> new ArrayList<>())
                    .add(task);
        }
        
        return arrivals;
    }
}
