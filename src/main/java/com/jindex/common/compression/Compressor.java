package com.jindex.common.compression;

import java.io.IOException;

/**
 * Compresses whole artifact payloads.
 */
public interface Compressor {

    CompressionCodec codec();

    /**
     * Compresses the given data.
     *
     * @param uncompressed The data to compress
     * @return The compressed bytes
     * @throws IOException If the codec fails
     */
    byte[] compress(byte[] uncompressed) throws IOException;

    /**
     * Decompresses the given data.
     *
     * @param compressed The data to decompress
     * @param uncompressedLength The expected length of the uncompressed data
     * @return The decompressed bytes, exactly {@code uncompressedLength} long
     * @throws IOException If the data is damaged or does not inflate to the expected length
     */
    byte[] decompress(byte[] compressed, int uncompressedLength) throws IOException;
}
