package io.github.coderodde.heap;

/**
 * Thrown when a task is inserted while another task with the same ID is 
 * still queued.
 */
public class DuplicateIdException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String taskId;

    public DuplicateIdException(String taskId) {
        super("Task with id=" + taskId + " already exists in the queue.");
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
