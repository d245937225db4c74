package com.jindex.common.compression;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Compressor implementation using GZIP compression.
 */
public class GzipCompressor implements Compressor {

    @Override
    public CompressionCodec codec() {
        return CompressionCodec.GZIP;
    }

    @Override
    public byte[] compress(byte[] uncompressed) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (GZIPOutputStream gzos = new GZIPOutputStream(baos)) {
            gzos.write(uncompressed);
        }
        return baos.toByteArray();
    }

    @Override
    public byte[] decompress(byte[] compressed, int uncompressedLength) throws IOException {
        try (GZIPInputStream gzis = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            byte[] output = gzis.readNBytes(uncompressedLength);
            CompressorFactory.checkLength(codec(), uncompressedLength, output.length);
            if (gzis.read() != -1) {
                throw new IOException("GZIP payload inflates past " + uncompressedLength + " bytes");
            }
            return output;
        }
    }
}
