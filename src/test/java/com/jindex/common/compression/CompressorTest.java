package com.jindex.common.compression;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class CompressorTest {
    private static final String TEST_STRING = "This is a test string that should compress well " +
        "because it contains repeated patterns. This is a test string that should compress well " +
        "because it contains repeated patterns.";

    @ParameterizedTest
    @EnumSource(value = CompressionCodec.class, names = {"SNAPPY", "GZIP", "ZSTD"})
    void shouldCompressAndDecompress(CompressionCodec codec) throws IOException {
        byte[] data = TEST_STRING.getBytes(StandardCharsets.UTF_8);
        Compressor compressor = CompressorFactory.getCompressor(codec);

        byte[] compressed = compressor.compress(data);

        assertThat(compressor.codec()).isEqualTo(codec);
        assertThat(compressed.length).isLessThan(data.length);
        assertThat(new String(compressor.decompress(compressed, data.length), StandardCharsets.UTF_8))
            .isEqualTo(TEST_STRING);
    }

    @ParameterizedTest
    @EnumSource(value = CompressionCodec.class, names = {"UNCOMPRESSED", "SNAPPY", "GZIP"})
    void shouldHandleEmptyPayloads(CompressionCodec codec) throws IOException {
        Compressor compressor = CompressorFactory.getCompressor(codec);

        byte[] compressed = compressor.compress(new byte[0]);

        assertThat(compressor.decompress(compressed, 0)).isEmpty();
    }

    @Test
    void shouldHandleUncompressedData() throws IOException {
        byte[] data = TEST_STRING.getBytes(StandardCharsets.UTF_8);
        Compressor compressor = CompressorFactory.getCompressor(CompressionCodec.UNCOMPRESSED);

        byte[] compressed = compressor.compress(data);

        assertThat(compressed).isEqualTo(data).isNotSameAs(data);
        assertThat(compressor.decompress(compressed, data.length)).isEqualTo(data);
    }

    @ParameterizedTest
    @EnumSource(CompressionCodec.class)
    void shouldRejectWrongExpectedLength(CompressionCodec codec) throws IOException {
        byte[] data = TEST_STRING.getBytes(StandardCharsets.UTF_8);
        Compressor compressor = CompressorFactory.getCompressor(codec);
        byte[] compressed = compressor.compress(data);

        assertThatThrownBy(() -> compressor.decompress(compressed, data.length + 7))
            .isInstanceOf(IOException.class);
    }

    @ParameterizedTest
    @EnumSource(CompressionCodec.class)
    void shouldRejectAnOversizedExpectedLength(CompressionCodec codec) throws IOException {
        byte[] data = TEST_STRING.getBytes(StandardCharsets.UTF_8);
        Compressor compressor = CompressorFactory.getCompressor(codec);
        byte[] compressed = compressor.compress(data);

        assertThatThrownBy(() -> compressor.decompress(compressed, Integer.MAX_VALUE))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("size mismatch");
    }

    @Test
    void shouldWrapZstdFrameErrors() {
        byte[] garbage = new byte[32];
        Compressor compressor = CompressorFactory.getCompressor(CompressionCodec.ZSTD);

        assertThatThrownBy(() -> compressor.decompress(garbage, 64))
            .isInstanceOf(IOException.class);
    }

    @ParameterizedTest
    @EnumSource(value = CompressionCodec.class, names = {"SNAPPY", "GZIP", "ZSTD"})
    void shouldRejectDamagedPayloads(CompressionCodec codec) throws IOException {
        byte[] data = TEST_STRING.getBytes(StandardCharsets.UTF_8);
        Compressor compressor = CompressorFactory.getCompressor(codec);
        byte[] truncated = Arrays.copyOf(compressor.compress(data), 6);

        assertThatThrownBy(() -> compressor.decompress(truncated, data.length))
            .isInstanceOf(IOException.class);
    }

    @Test
    void shouldResolveCodecValues() {
        assertThat(CompressionCodec.fromValue(3)).isEqualTo(CompressionCodec.ZSTD);
        assertThatThrownBy(() -> CompressionCodec.fromValue(42))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown compression codec value");
    }
}
