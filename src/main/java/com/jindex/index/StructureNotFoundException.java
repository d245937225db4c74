package com.jindex.index;

/**
 * Thrown when a query names a structure type, registered structure or filter
 * field that does not exist.
 */
public class StructureNotFoundException extends IndexException {

    public StructureNotFoundException(String message) {
        super(message);
    }
}
