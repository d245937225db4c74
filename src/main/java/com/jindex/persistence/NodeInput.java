package com.jindex.persistence;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.util.Map;

/**
 * Source of a structure's node graph, read from a fully buffered payload.
 * Counts and depths are validated so a damaged payload surfaces as
 * {@link PersistenceCorruptException} instead of a runaway allocation.
 */
public class NodeInput {
    private final ByteArrayInputStream bytes;
    private final DataInputStream in;
    private final int maxDepth;

    public NodeInput(byte[] payload, int maxDepth) {
        this.bytes = new ByteArrayInputStream(payload);
        this.in = new DataInputStream(bytes);
        this.maxDepth = maxDepth;
    }

    /**
     * Records that a node at {@code depth} (root = 1) is being rebuilt.
     */
    public void enterNode(int depth) throws PersistenceCorruptException {
        if (depth > maxDepth) {
            throw new PersistenceCorruptException(
                "Node depth " + depth + " exceeds the limit of " + maxDepth);
        }
    }

    public byte readByte() throws IOException {
        return in.readByte();
    }

    public boolean readBoolean() throws IOException {
        return in.readBoolean();
    }

    public char readChar() throws IOException {
        return in.readChar();
    }

    public int readInt() throws IOException {
        return in.readInt();
    }

    public long readLong() throws IOException {
        return in.readLong();
    }

    public double readDouble() throws IOException {
        return in.readDouble();
    }

    public String readString() throws IOException {
        return RecordCodec.readString(in);
    }

    public Map<String, Object> readRecord() throws IOException {
        return RecordCodec.read(in);
    }

    /**
     * Reads an element count. Every element takes at least one byte, so a
     * count larger than the unread payload is corrupt.
     */
    public int readCount(String what) throws IOException {
        int count = in.readInt();
        if (count < 0 || count > bytes.available()) {
            throw new PersistenceCorruptException("Invalid " + what + " count: " + count);
        }
        return count;
    }

    /**
     * Reads a slot reference that must lie in {@code [0, bound)}.
     */
    public int readSlot(int bound) throws IOException {
        int slot = in.readInt();
        if (slot < 0 || slot >= bound) {
            throw new PersistenceCorruptException("Slot " + slot + " out of range [0, " + bound + ")");
        }
        return slot;
    }

    public int remaining() {
        return bytes.available();
    }
}
