package io.github.coderodde.heap;

import java.util.Objects;

/**
 * This class models a schedulable task. The only mutable field is the 
 * priority, and only {@link IndexedPriorityQueue} may change it, since the 
 * queue has to restore its heap order after every change.
 * 
 * <p>A task may be held by at most one queue at a time.
 * 
 * <p>Equality is identity: the queue tracks tasks by {@link #getTaskId()}.
 */
public final class Task {
    
    private final String taskId;
    private int priority;
    private final int arrivalTime;
    private final Integer deadline;
    private final String metadata;
    
    // The queue currently holding this task, or null.
    private IndexedPriorityQueue owner;
    
    public Task(String taskId, int priority) {
        this(taskId, priority, 0);
    }
    
    public Task(String taskId, int priority, int arrivalTime) {
        this(taskId, priority, arrivalTime, null);
    }
    
    public Task(String taskId, 
                int priority, 
                int arrivalTime, 
                Integer deadline) {
        this(taskId, priority, arrivalTime, deadline, "");
    }
    
    /**
     * Constructs a new task.
     * 
     * @param taskId      the unique identifier of the task.
     * @param priority    the initial priority. Higher is more urgent.
     * @param arrivalTime the tick at which the task becomes available.
     * @param deadline    the deadline or {@code null} if there is none.
     * @param metadata    the opaque payload.
     */
    public Task(String taskId, 
                int priority, 
                int arrivalTime, 
                Integer deadline,
                String metadata) {
        
        this.taskId = Objects.requireNonNull(taskId, "The task ID is null.");
        this.metadata = Objects.requireNonNull(metadata, 
                                               "The metadata is null.");
        
        if (arrivalTime < 0) {
            throw new IllegalArgumentException(
                    "The arrival time is negative: " + arrivalTime);
        }
        
        this.priority    = priority;
        this.arrivalTime = arrivalTime;
        this.deadline    = deadline;
    }

    public String getTaskId() {
        return taskId;
    }

    public int getPriority() {
        return priority;
    }

    public int getArrivalTime() {
        return arrivalTime;
    }

    public Integer getDeadline() {
        return deadline;
    }

    public String getMetadata() {
        return metadata;
    }
    
    void setPriority(int priority) {
        this.priority = priority;
    }
    
    IndexedPriorityQueue getOwner() {
        return owner;
    }
    
    void setOwner(IndexedPriorityQueue owner) {
        this.owner = owner;
    }
    
    @Override
    public String toString() {
        return "Task(id=" + taskId 
                + ", pr=" + priority 
                + ", at=" + arrivalTime 
                + ", dl=" + deadline + ")";
    }
}
