package com.jindex.persistence;

import com.jindex.index.IndexType;

import java.util.Objects;

/**
 * One artifact found on disk, described without loading it.
 */
public class SavedIndex {
    private final String dataset;
    private final IndexType type;
    private final String fileName;
    private final long sizeBytes;

    public SavedIndex(String dataset, IndexType type, String fileName, long sizeBytes) {
        this.dataset = dataset;
        this.type = type;
        this.fileName = fileName;
        this.sizeBytes = sizeBytes;
    }

    public String getDataset() {
        return dataset;
    }

    public IndexType getType() {
        return type;
    }

    public String getFileName() {
        return fileName;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SavedIndex)) {
            return false;
        }
        SavedIndex that = (SavedIndex) o;
        return sizeBytes == that.sizeBytes && dataset.equals(that.dataset) && type == that.type
            && fileName.equals(that.fileName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataset, type, fileName, sizeBytes);
    }

    @Override
    public String toString() {
        return "SavedIndex{" + dataset + "/" + type.getToken() + ", " + fileName + ", " + sizeBytes + " bytes}";
    }
}
