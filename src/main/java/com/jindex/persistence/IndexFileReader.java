package com.jindex.persistence;

import com.jindex.common.compression.CompressorFactory;
import com.jindex.hash.BucketHashMap;
import com.jindex.index.IndexType;
import com.jindex.index.ScannableIndex;
import com.jindex.prefix.SortedArrayIndex;
import com.jindex.prefix.TernarySearchTree;
import com.jindex.tree.AvlTree;
import com.jindex.tree.BinarySearchTree;
import com.jindex.tree.RedBlackTree;
import com.jindex.trie.CharacterTrie;
import com.jindex.trie.DigitTrie;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Reads artifacts written by {@link IndexFileWriter}. Every failure after the
 * file has been found is reported as {@link PersistenceCorruptException}.
 */
public class IndexFileReader {
    private final PersistenceConfig config;

    public IndexFileReader() {
        this(new PersistenceConfig.Builder().build());
    }

    public IndexFileReader(PersistenceConfig config) {
        this.config = config;
    }

    /**
     * Reads only the header.
     *
     * @throws PersistenceMissingException If the file does not exist
     */
    public IndexFileHeader readHeader(Path path) throws IOException {
        try (InputStream file = Files.newInputStream(path);
             DataInputStream in = new DataInputStream(file)) {
            return IndexFileHeader.read(in);
        } catch (NoSuchFileException e) {
            throw new PersistenceMissingException("File not found: " + path);
        } catch (EOFException e) {
            throw new PersistenceCorruptException("Truncated header: " + path, e);
        }
    }

    /**
     * Reads and rebuilds the structure stored at {@code path}. The result is frozen.
     *
     * @throws PersistenceMissingException If the file does not exist
     * @throws PersistenceCorruptException If the file cannot be restored
     */
    public ScannableIndex read(Path path) throws IOException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new PersistenceMissingException("File not found: " + path);
        }
        try {
            return decode(bytes);
        } catch (PersistenceCorruptException e) {
            throw new PersistenceCorruptException("Invalid index file " + path + ": " + e.getMessage(), e);
        }
    }

    ScannableIndex decode(byte[] bytes) throws IOException {
        if (bytes.length < IndexFileHeader.SIZE) {
            throw new PersistenceCorruptException("Truncated header, " + bytes.length + " bytes");
        }
        IndexFileHeader header = IndexFileHeader.read(new DataInputStream(new ByteArrayInputStream(bytes)));
        int available = bytes.length - IndexFileHeader.SIZE;
        if (available != header.getCompressedLength()) {
            throw new PersistenceCorruptException("Payload is " + available + " bytes, header says "
                + header.getCompressedLength());
        }
        byte[] compressed = Arrays.copyOfRange(bytes, IndexFileHeader.SIZE, bytes.length);
        byte[] payload;
        try {
            payload = CompressorFactory.getCompressor(header.getCodec())
                .decompress(compressed, header.getUncompressedLength());
        } catch (IOException e) {
            throw new PersistenceCorruptException(header.getCodec() + " payload cannot be decompressed", e);
        }
        if (IndexFileWriter.checksum(payload) != header.getChecksum()) {
            throw new PersistenceCorruptException("Checksum mismatch");
        }
        ScannableIndex index = deserialize(header.getType(), payload);
        index.freeze();
        return index;
    }

    /**
     * Rebuilds a structure from an uncompressed node graph.
     */
    public ScannableIndex deserialize(IndexType type, byte[] payload) throws IOException {
        NodeInput in = new NodeInput(payload, config.getMaxTraversalDepth());
        ScannableIndex index;
        try {
            index = switch (type) {
                case BST -> BinarySearchTree.readFrom(in);
                case AVL -> AvlTree.readFrom(in);
                case RED_BLACK -> RedBlackTree.readFrom(in);
                case DIGIT_TRIE -> DigitTrie.readFrom(in);
                case CHARACTER_TRIE -> CharacterTrie.readFrom(in);
                case TERNARY_SEARCH_TREE -> TernarySearchTree.readFrom(in);
                case SORTED_ARRAY -> SortedArrayIndex.readFrom(in);
                case HASH_MAP -> BucketHashMap.readFrom(in);
            };
        } catch (PersistenceCorruptException e) {
            throw e;
        } catch (IOException e) {
            throw new PersistenceCorruptException("Truncated " + type.getToken() + " payload", e);
        }
        if (in.remaining() != 0) {
            throw new PersistenceCorruptException(in.remaining() + " trailing bytes after " + type.getToken());
        }
        return index;
    }
}
