package io.github.coderodde.heap;

/**
 * Thrown by {@link HeapSort} when two elements cannot be ordered relative to
 * each other.
 */
public class ComparisonException extends ClassCastException {

    private static final long serialVersionUID = 1L;

    public ComparisonException(String message) {
        super(message);
    }
    
    public ComparisonException(String message, Throwable cause) {
        super(message);
        initCause(cause);
    }
}
