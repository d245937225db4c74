package com.jindex.common.compression;

import org.xerial.snappy.Snappy;

import java.io.IOException;

/**
 * Compressor implementation using Snappy compression.
 */
public class SnappyCompressor implements Compressor {

    @Override
    public CompressionCodec codec() {
        return CompressionCodec.SNAPPY;
    }

    @Override
    public byte[] compress(byte[] uncompressed) throws IOException {
        return Snappy.compress(uncompressed);
    }

    @Override
    public byte[] decompress(byte[] compressed, int uncompressedLength) throws IOException {
        if (!Snappy.isValidCompressedBuffer(compressed)) {
            throw new IOException("Invalid Snappy payload");
        }
        byte[] decompressed = Snappy.uncompress(compressed);
        CompressorFactory.checkLength(codec(), uncompressedLength, decompressed.length);
        return decompressed;
    }
}
