package com.jindex.persistence;

import com.jindex.common.compression.Compressor;
import com.jindex.common.compression.CompressorFactory;
import com.jindex.index.ScannableIndex;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.CRC32;

/**
 * Writes one structure to one artifact: header, then the compressed node graph.
 */
public class IndexFileWriter {
    private final PersistenceConfig config;

    public IndexFileWriter() {
        this(new PersistenceConfig.Builder().build());
    }

    public IndexFileWriter(PersistenceConfig config) {
        this.config = config;
    }

    /**
     * Serializes the node graph without compression or header.
     *
     * @throws com.jindex.index.RecursionDepthExceededException If the structure is deeper than the traversal budget
     */
    public byte[] serialize(ScannableIndex index) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        NodeOutput out = new NodeOutput(bytes, config.getMaxTraversalDepth());
        index.writeTo(out);
        out.flush();
        return bytes.toByteArray();
    }

    /**
     * Writes the structure to {@code path}, replacing any existing file. The
     * whole payload is built in memory first, so a structure that cannot be
     * serialized leaves no file behind.
     *
     * @return Size of the artifact in bytes
     * @throws IOException if there's an error writing the file
     */
    public long write(ScannableIndex index, Path path) throws IOException {
        byte[] payload = serialize(index);
        Compressor compressor = CompressorFactory.getCompressor(config.getCompressionCodec());
        byte[] compressed = compressor.compress(payload);
        IndexFileHeader header = new IndexFileHeader(index.type(), compressor.codec(),
            payload.length, compressed.length, checksum(payload));
        try (OutputStream file = Files.newOutputStream(path);
             DataOutputStream out = new DataOutputStream(file)) {
            header.write(out);
            out.write(compressed);
        } catch (IOException e) {
            throw new IOException("Unable to write to file: " + path, e);
        }
        return IndexFileHeader.SIZE + (long) compressed.length;
    }

    static int checksum(byte[] payload) {
        CRC32 crc = new CRC32();
        crc.update(payload, 0, payload.length);
        return (int) crc.getValue();
    }
}
