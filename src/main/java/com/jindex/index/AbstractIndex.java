package com.jindex.index;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Lifecycle and bookkeeping common to all structures: the frozen marker, the
 * record count, and the set of known field names.
 */
public abstract class AbstractIndex implements ScannableIndex {
    private final Set<String> fieldNames = new HashSet<>();
    private volatile boolean frozen;
    protected int size;

    /**
     * Checks that the index still accepts inserts and takes an immutable copy
     * of the record. Call before touching any node.
     */
    protected Map<String, Object> admit(Map<String, Object> record) {
        if (frozen) {
            throw new IllegalStateException(type() + " index is frozen");
        }
        return restore(Objects.requireNonNull(record, "record"));
    }

    /**
     * Registers a record read back from storage.
     */
    protected Map<String, Object> restore(Map<String, Object> record) {
        fieldNames.addAll(record.keySet());
        return Collections.unmodifiableMap(new LinkedHashMap<>(record));
    }

    @Override
    public int getSize() {
        return size;
    }

    @Override
    public Set<String> fieldNames() {
        return Collections.unmodifiableSet(fieldNames);
    }

    @Override
    public void freeze() {
        frozen = true;
    }

    @Override
    public boolean isFrozen() {
        return frozen;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(size=" + getSize() + ", height=" + getHeight() + ")";
    }
}
