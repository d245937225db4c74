package com.jindex.persistence;

import java.io.IOException;

/**
 * Thrown when an artifact exists but cannot be restored.
 */
public class PersistenceCorruptException extends IOException {

    public PersistenceCorruptException(String message) {
        super(message);
    }

    public PersistenceCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
