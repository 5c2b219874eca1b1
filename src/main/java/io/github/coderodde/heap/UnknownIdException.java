package io.github.coderodde.heap;

import java.util.NoSuchElementException;

/**
 * Thrown when an operation references a task ID that is not present in the
 * queue.
 */
public class UnknownIdException extends NoSuchElementException {

    private static final long serialVersionUID = 1L;

    private final String taskId;

    public UnknownIdException(String taskId) {
        super("Task id=" + taskId + " not found.");
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
