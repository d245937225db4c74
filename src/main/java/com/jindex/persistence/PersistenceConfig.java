package com.jindex.persistence;

import com.jindex.common.compression.CompressionCodec;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Configuration for index persistence.
 */
public class PersistenceConfig {
    private final Path directory;
    private final CompressionCodec compressionCodec;
    private final int maxTraversalDepth;

    private PersistenceConfig(Builder builder) {
        this.directory = builder.directory;
        this.compressionCodec = builder.compressionCodec;
        this.maxTraversalDepth = builder.maxTraversalDepth;
    }

    /**
     * Directory holding one artifact per dataset and structure type.
     */
    public Path getDirectory() {
        return directory;
    }

    /**
     * Codec used for new artifacts. Existing artifacts are read with the
     * codec named in their header.
     */
    public CompressionCodec getCompressionCodec() {
        return compressionCodec;
    }

    /**
     * Deepest node the serializer will write or the reader will rebuild.
     */
    public int getMaxTraversalDepth() {
        return maxTraversalDepth;
    }

    public static class Builder {
        private Path directory = Paths.get("data", "indexes");
        private CompressionCodec compressionCodec = CompressionCodec.SNAPPY;
        private int maxTraversalDepth = 1_000_000;

        public Builder setDirectory(Path directory) {
            this.directory = Objects.requireNonNull(directory, "directory");
            return this;
        }

        public Builder setCompressionCodec(CompressionCodec compressionCodec) {
            this.compressionCodec = Objects.requireNonNull(compressionCodec, "compressionCodec");
            return this;
        }

        public Builder setMaxTraversalDepth(int maxTraversalDepth) {
            if (maxTraversalDepth < 1) {
                throw new IllegalArgumentException("maxTraversalDepth must be positive: " + maxTraversalDepth);
            }
            this.maxTraversalDepth = maxTraversalDepth;
            return this;
        }

        public PersistenceConfig build() {
            return new PersistenceConfig(this);
        }
    }
}
