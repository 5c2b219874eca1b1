package io.github.coderodde.heap;

/**
 * Thrown when {@link IndexedPriorityQueue#increaseKey(String, int)} would 
 * lower a priority or {@link IndexedPriorityQueue#decreaseKey(String, int)} 
 * would raise one.
 */
public class InvalidKeyChangeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidKeyChangeException(String message) {
        super(message);
    }
}
