package com.jindex.common.compression;

import java.io.IOException;

/**
 * Factory for creating compressors based on compression codec.
 */
public class CompressorFactory {

    private CompressorFactory() {
    }

    /**
     * Returns a compressor for the given codec.
     *
     * @param codec The compression codec to use
     * @return A compressor that implements the specified codec
     */
    public static Compressor getCompressor(CompressionCodec codec) {
        return switch (codec) {
            case UNCOMPRESSED -> new UncompressedCompressor();
            case SNAPPY -> new SnappyCompressor();
            case GZIP -> new GzipCompressor();
            case ZSTD -> new ZstdCompressor();
        };
    }

    static void checkLength(CompressionCodec codec, int expected, long actual) throws IOException {
        if (actual != expected) {
            throw new IOException(codec + " decompressed size mismatch. Expected: " + expected
                + ", Got: " + actual);
        }
    }
}
