package io.github.coderodde.heap;

import java.util.Objects;

/**
 * One entry of a schedule trace: the task that ran at the given tick.
 */
public final class Execution {
    
    private final int tick;
    private final Task task;
    
    public Execution(int tick, Task task) {
        this.tick = tick;
        this.task = Objects.requireNonNull(task, "The task is null.");
    }

    public int getTick() {
        return tick;
    }

    public Task getTask() {
        return task;
    }
    
    public String getTaskId() {
        return task.getTaskId();
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        
        if (!(o instanceof Execution)) {
            return false;
        }
        
        Execution other = (Execution) o;
        return tick == other.tick && task == other.task;
    }
    
    @Override
    public int hashCode() {
        return 31 * tick + task.getTaskId().hashCode();
    }
    
    @Override
    public String toString() {
        return "t=" + tick + ": " + task;
    }
}
