package com.jindex.index;

/**
 * Base type for in-memory index failures. I/O failures are reported as
 * {@link java.io.IOException}s instead.
 */
public class IndexException extends RuntimeException {

    public IndexException(String message) {
        super(message);
    }

    public IndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
