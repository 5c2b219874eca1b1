package io.github.coderodde.heap;

import java.util.NoSuchElementException;

/**
 * Thrown when a task is requested from an empty
 * {@link IndexedPriorityQueue}.
 */
public class EmptyQueueException extends NoSuchElementException {

    private static final long serialVersionUID = 1L;

    public EmptyQueueException(String message) {
        super(message);
    }
}
