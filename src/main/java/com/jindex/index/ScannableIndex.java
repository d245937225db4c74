package com.jindex.index;

import com.jindex.filter.FieldPredicate;
import com.jindex.filter.FilterEngine;
import com.jindex.persistence.NodeOutput;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Capabilities shared by every index structure: a full record scan, field
 * filtering on top of it, the build/read lifecycle, and serialization.
 *
 * <p>Structures are built by a single thread. Once {@link #freeze()} has been
 * called they reject further inserts and may be queried from any number of
 * threads.
 */
public interface ScannableIndex {

    IndexType type();

    /**
     * @return Number of records stored
     */
    int getSize();

    /**
     * @return Height of the structure, or 0 for flat structures
     */
    int getHeight();

    /**
     * Visits every stored record once.
     */
    void forEachRecord(Consumer<Map<String, Object>> action);

    /**
     * Names of every field carried by at least one stored record.
     */
    Set<String> fieldNames();

    /**
     * Ends the build phase. Subsequent inserts throw {@link IllegalStateException}.
     */
    void freeze();

    boolean isFrozen();

    /**
     * Writes the full node graph of this structure.
     *
     * @param out Destination for the node graph
     * @throws IOException If writing fails
     */
    void writeTo(NodeOutput out) throws IOException;

    default List<Map<String, Object>> getAllRecords() {
        List<Map<String, Object>> records = new ArrayList<>(getSize());
        forEachRecord(records::add);
        return records;
    }

    /**
     * Linear scan over every record, keeping those whose field satisfies the
     * predicate. Records without the field are skipped. An empty structure
     * has no fields to check against and yields an empty list for any field.
     *
     * @throws StructureNotFoundException If the structure is non-empty and no
     *                                    stored record carries the field
     */
    default List<Map<String, Object>> filterByField(String field, FieldPredicate predicate) {
        return FilterEngine.filterByField(this, field, predicate);
    }
}
