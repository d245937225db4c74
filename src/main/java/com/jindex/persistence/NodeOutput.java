package com.jindex.persistence;

import com.jindex.index.RecursionDepthExceededException;

import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Map;

/**
 * Sink for a structure's node graph. Structures report each node they write
 * together with its depth, which is checked against the traversal budget.
 */
public class NodeOutput {
    private final DataOutputStream out;
    private final int maxDepth;

    public NodeOutput(OutputStream out, int maxDepth) {
        this.out = new DataOutputStream(out);
        this.maxDepth = maxDepth;
    }

    /**
     * Records that a node at {@code depth} (root = 1) is about to be written.
     *
     * @throws RecursionDepthExceededException If the depth is over budget
     */
    public void enterNode(int depth) {
        if (depth > maxDepth) {
            throw new RecursionDepthExceededException(depth, maxDepth);
        }
    }

    public void writeByte(int value) throws IOException {
        out.writeByte(value);
    }

    public void writeBoolean(boolean value) throws IOException {
        out.writeBoolean(value);
    }

    public void writeChar(char value) throws IOException {
        out.writeChar(value);
    }

    public void writeInt(int value) throws IOException {
        out.writeInt(value);
    }

    public void writeLong(long value) throws IOException {
        out.writeLong(value);
    }

    public void writeDouble(double value) throws IOException {
        out.writeDouble(value);
    }

    public void writeString(String value) throws IOException {
        RecordCodec.writeString(out, value);
    }

    public void writeRecord(Map<String, Object> record) throws IOException {
        RecordCodec.write(out, record);
    }

    public void flush() throws IOException {
        out.flush();
    }
}
