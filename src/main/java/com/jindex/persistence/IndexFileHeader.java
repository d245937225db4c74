package com.jindex.persistence;

import com.jindex.common.compression.CompressionCodec;
import com.jindex.index.IndexType;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

/**
 * Fixed-size header at the start of every index artifact:
 * <pre>
 *   magic              (4B) "JIX1"
 *   version            (2B)
 *   type code          (4B)
 *   codec              (4B)
 *   uncompressed size  (4B)
 *   compressed size    (4B)
 *   crc32              (4B) of the uncompressed payload
 * </pre>
 */
public class IndexFileHeader {
    public static final int MAGIC = 0x4A495831; // "JIX1" in ASCII
    public static final short VERSION = 1;
    public static final int SIZE = 26;

    private final IndexType type;
    private final CompressionCodec codec;
    private final int uncompressedLength;
    private final int compressedLength;
    private final int checksum;

    public IndexFileHeader(IndexType type, CompressionCodec codec, int uncompressedLength,
                           int compressedLength, int checksum) {
        this.type = type;
        this.codec = codec;
        this.uncompressedLength = uncompressedLength;
        this.compressedLength = compressedLength;
        this.checksum = checksum;
    }

    void write(DataOutputStream out) throws IOException {
        out.writeInt(MAGIC);
        out.writeShort(VERSION);
        out.writeInt(type.getCode());
        out.writeInt(codec.getValue());
        out.writeInt(uncompressedLength);
        out.writeInt(compressedLength);
        out.writeInt(checksum);
    }

    /**
     * Reads and validates a header.
     *
     * @throws PersistenceCorruptException If the magic, version, type, codec or lengths are invalid
     */
    static IndexFileHeader read(DataInputStream in) throws IOException {
        int magic = in.readInt();
        if (magic != MAGIC) {
            throw new PersistenceCorruptException(String.format("Bad magic number 0x%08X", magic));
        }
        short version = in.readShort();
        if (version != VERSION) {
            throw new PersistenceCorruptException("Unsupported artifact version: " + version);
        }
        IndexType type;
        CompressionCodec codec;
        try {
            type = IndexType.fromCode(in.readInt());
            codec = CompressionCodec.fromValue(in.readInt());
        } catch (IllegalArgumentException e) {
            throw new PersistenceCorruptException(e.getMessage(), e);
        }
        int uncompressedLength = in.readInt();
        int compressedLength = in.readInt();
        if (uncompressedLength < 0 || compressedLength < 0) {
            throw new PersistenceCorruptException(
                "Negative payload length: " + uncompressedLength + "/" + compressedLength);
        }
        return new IndexFileHeader(type, codec, uncompressedLength, compressedLength, in.readInt());
    }

    public IndexType getType() {
        return type;
    }

    public CompressionCodec getCodec() {
        return codec;
    }

    public int getUncompressedLength() {
        return uncompressedLength;
    }

    public int getCompressedLength() {
        return compressedLength;
    }

    public int getChecksum() {
        return checksum;
    }
}
