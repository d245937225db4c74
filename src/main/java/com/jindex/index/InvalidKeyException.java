package com.jindex.index;

/**
 * Thrown when a key presented for insertion cannot be indexed. The structure
 * is left untouched.
 */
public class InvalidKeyException extends IndexException {

    public InvalidKeyException(String message) {
        super(message);
    }

    public InvalidKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
