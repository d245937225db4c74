package com.jindex.common.compression;

import com.github.luben.zstd.Zstd;
import com.github.luben.zstd.ZstdException;

import java.io.IOException;
import java.util.Arrays;

/**
 * Compressor implementation using Zstandard compression.
 */
public class ZstdCompressor implements Compressor {
    private static final int COMPRESSION_LEVEL = 3; // Default compression level

    @Override
    public CompressionCodec codec() {
        return CompressionCodec.ZSTD;
    }

    @Override
    public byte[] compress(byte[] uncompressed) throws IOException {
        try {
            byte[] compressed = new byte[(int) Zstd.compressBound(uncompressed.length)];
            long compressedSize = Zstd.compressByteArray(
                compressed, 0, compressed.length,
                uncompressed, 0, uncompressed.length,
                COMPRESSION_LEVEL
            );
            if (Zstd.isError(compressedSize)) {
                throw new IOException("Failed to compress data with Zstd: " + Zstd.getErrorName(compressedSize));
            }
            return Arrays.copyOf(compressed, (int) compressedSize);
        } catch (ZstdException e) {
            throw new IOException("Failed to compress data with Zstd", e);
        }
    }

    /**
     * The frame's recorded content size must match {@code uncompressedLength}
     * before any output buffer is allocated.
     */
    @Override
    public byte[] decompress(byte[] compressed, int uncompressedLength) throws IOException {
        try {
            long frameSize = Zstd.decompressedSize(compressed);
            CompressorFactory.checkLength(codec(), uncompressedLength, frameSize);
            byte[] decompressed = new byte[uncompressedLength];
            long decompressedSize = Zstd.decompressByteArray(
                decompressed, 0, decompressed.length,
                compressed, 0, compressed.length
            );
            if (Zstd.isError(decompressedSize)) {
                throw new IOException("Failed to decompress data with Zstd: " + Zstd.getErrorName(decompressedSize));
            }
            CompressorFactory.checkLength(codec(), uncompressedLength, decompressedSize);
            return decompressed;
        } catch (ZstdException e) {
            throw new IOException("Failed to decompress data with Zstd", e);
        }
    }
}
