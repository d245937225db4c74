package com.jindex.common.compression;

/**
 * Codecs available for index artifact payloads. The value is the code
 * written into the artifact header.
 */
public enum CompressionCodec {
    UNCOMPRESSED(0),
    SNAPPY(1),
    GZIP(2),
    ZSTD(3);

    private final int value;

    CompressionCodec(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    public static CompressionCodec fromValue(int value) {
        for (CompressionCodec codec : values()) {
            if (codec.value == value) {
                return codec;
            }
        }
        throw new IllegalArgumentException("Unknown compression codec value: " + value);
    }
}
