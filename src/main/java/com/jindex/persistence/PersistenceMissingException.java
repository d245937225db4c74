package com.jindex.persistence;

import java.io.IOException;

/**
 * Thrown when no artifact exists for the requested dataset and structure type.
 */
public class PersistenceMissingException extends IOException {

    public PersistenceMissingException(String message) {
        super(message);
    }
}
