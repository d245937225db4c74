package com.jindex.common.compression;

import java.io.IOException;
import java.util.Arrays;

/**
 * A "compressor" that stores the payload as is.
 */
public class UncompressedCompressor implements Compressor {

    @Override
    public CompressionCodec codec() {
        return CompressionCodec.UNCOMPRESSED;
    }

    @Override
    public byte[] compress(byte[] uncompressed) {
        return Arrays.copyOf(uncompressed, uncompressed.length);
    }

    @Override
    public byte[] decompress(byte[] compressed, int uncompressedLength) throws IOException {
        CompressorFactory.checkLength(codec(), uncompressedLength, compressed.length);
        return Arrays.copyOf(compressed, compressed.length);
    }
}
