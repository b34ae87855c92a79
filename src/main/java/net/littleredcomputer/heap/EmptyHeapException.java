package net.littleredcomputer.heap;

/**
 * Thrown when an operation needs the root of a heap that has no elements.
 */
public class EmptyHeapException extends IllegalStateException {
    EmptyHeapException(String operation) {
        super(operation + " on empty heap");
    }
}
