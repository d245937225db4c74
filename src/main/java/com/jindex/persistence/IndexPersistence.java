package com.jindex.persistence;

import com.jindex.index.IndexType;
import com.jindex.index.ScannableIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Dataset-scoped store of index artifacts. Each (dataset, structure type)
 * pair maps to one file named {@code {dataset}_{type}_index.jix} in the
 * configured directory.
 *
 * <p>Saves are blocking and not atomic: a failure mid-write leaves a damaged
 * file, which {@link #verify(String, IndexType)} detects.
 */
public class IndexPersistence {
    private static final Logger logger = LoggerFactory.getLogger(IndexPersistence.class);

    public static final String FILE_SUFFIX = "_index.jix";
    private static final Pattern DATASET_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]*");

    private final PersistenceConfig config;
    private final IndexFileWriter writer;
    private final IndexFileReader reader;

    public IndexPersistence() {
        this(new PersistenceConfig.Builder().build());
    }

    public IndexPersistence(PersistenceConfig config) {
        this.config = config;
        this.writer = new IndexFileWriter(config);
        this.reader = new IndexFileReader(config);
    }

    public PersistenceConfig getConfig() {
        return config;
    }

    public Path pathFor(String dataset, IndexType type) {
        return config.getDirectory().resolve(checkDataset(dataset) + "_" + type.getToken() + FILE_SUFFIX);
    }

    /**
     * Saves a structure under its own type.
     *
     * @throws com.jindex.index.RecursionDepthExceededException If the structure is deeper than the traversal budget
     */
    public SavedIndex save(ScannableIndex index, String dataset) throws IOException {
        long start = System.nanoTime();
        Path path = pathFor(dataset, index.type());
        Files.createDirectories(config.getDirectory());
        long bytes = writer.write(index, path);
        logger.info("Saved {} index for dataset {}: {} records, {} bytes in {} ms",
            index.type().getToken(), dataset, index.getSize(), bytes, elapsedMillis(start));
        return new SavedIndex(dataset, index.type(), path.getFileName().toString(), bytes);
    }

    /**
     * Saves a structure under an explicit structure name, which must resolve
     * to the structure's own type.
     */
    public SavedIndex save(ScannableIndex index, String dataset, String structureName) throws IOException {
        IndexType named = IndexType.fromName(structureName);
        if (named != index.type()) {
            throw new IllegalArgumentException("Structure name '" + structureName + "' does not match a "
                + index.type().getToken() + " index");
        }
        return save(index, dataset);
    }

    /**
     * Loads one structure. The result is frozen.
     *
     * @throws PersistenceMissingException If no artifact exists
     * @throws PersistenceCorruptException If the artifact cannot be restored
     */
    public ScannableIndex load(String dataset, IndexType type) throws IOException {
        long start = System.nanoTime();
        Path path = pathFor(dataset, type);
        if (!Files.exists(path)) {
            logger.warn("No saved {} index for dataset {}", type.getToken(), dataset);
            throw new PersistenceMissingException("No saved " + type.getToken() + " index for dataset " + dataset);
        }
        ScannableIndex index = reader.read(path);
        if (index.type() != type) {
            throw new PersistenceCorruptException(path + " holds a " + index.type().getToken() + " index");
        }
        logger.info("Loaded {} index for dataset {}: {} records, {} bytes in {} ms",
            type.getToken(), dataset, index.getSize(), Files.size(path), elapsedMillis(start));
        return index;
    }

    /**
     * Loads the requested structures, in the order given.
     *
     * @throws PersistenceMissingException For the first requested type with no artifact
     */
    public Map<IndexType, ScannableIndex> load(String dataset, Collection<IndexType> types) throws IOException {
        Map<IndexType, ScannableIndex> loaded = new EnumMap<>(IndexType.class);
        for (IndexType type : types) {
            loaded.put(type, load(dataset, type));
        }
        return loaded;
    }

    /**
     * Loads every structure saved for the dataset.
     *
     * @throws PersistenceMissingException If nothing is saved for the dataset
     */
    public Map<IndexType, ScannableIndex> load(String dataset) throws IOException {
        List<IndexType> types = new ArrayList<>();
        for (SavedIndex saved : listSaved(dataset)) {
            types.add(saved.getType());
        }
        if (types.isEmpty()) {
            logger.warn("No saved indexes for dataset {}", dataset);
            throw new PersistenceMissingException("No saved indexes for dataset " + dataset);
        }
        return load(dataset, types);
    }

    /**
     * Lists every artifact in the directory grouped by dataset, reading only
     * file headers. Files that are not artifacts are skipped.
     */
    public Map<String, List<SavedIndex>> listSaved() throws IOException {
        Map<String, List<SavedIndex>> saved = new TreeMap<>();
        Path directory = config.getDirectory();
        if (!Files.isDirectory(directory)) {
            return saved;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + FILE_SUFFIX)) {
            for (Path file : files) {
                describe(file).ifPresent(found ->
                    saved.computeIfAbsent(found.getDataset(), d -> new ArrayList<>()).add(found));
            }
        }
        for (List<SavedIndex> list : saved.values()) {
            list.sort(Comparator.comparing(SavedIndex::getType));
        }
        return saved;
    }

    public List<SavedIndex> listSaved(String dataset) throws IOException {
        checkDataset(dataset);
        return listSaved().getOrDefault(dataset, List.of());
    }

    private Optional<SavedIndex> describe(Path file) throws IOException {
        String fileName = file.getFileName().toString();
        String stem = fileName.substring(0, fileName.length() - FILE_SUFFIX.length());
        for (IndexType type : IndexType.values()) {
            String marker = "_" + type.getToken();
            if (!stem.endsWith(marker) || stem.length() == marker.length()) {
                continue;
            }
            String dataset = stem.substring(0, stem.length() - marker.length());
            try {
                IndexFileHeader header = reader.readHeader(file);
                if (header.getType() != type) {
                    logger.debug("Skipping {}: header says {}", fileName, header.getType().getToken());
                    return Optional.empty();
                }
            } catch (PersistenceCorruptException e) {
                logger.debug("Skipping {}: {}", fileName, e.getMessage());
                return Optional.empty();
            }
            return Optional.of(new SavedIndex(dataset, type, fileName, Files.size(file)));
        }
        logger.debug("Skipping {}: unknown structure type", fileName);
        return Optional.empty();
    }

    public boolean exists(String dataset, IndexType type) {
        return Files.isRegularFile(pathFor(dataset, type));
    }

    /**
     * @return True if an artifact was removed
     */
    public boolean delete(String dataset, IndexType type) throws IOException {
        boolean deleted = Files.deleteIfExists(pathFor(dataset, type));
        if (deleted) {
            logger.info("Deleted {} index for dataset {}", type.getToken(), dataset);
        }
        return deleted;
    }

    /**
     * Fully re-reads an artifact.
     *
     * @return Number of records in the restored structure
     * @throws PersistenceMissingException If no artifact exists
     * @throws PersistenceCorruptException If the artifact cannot be restored
     */
    public int verify(String dataset, IndexType type) throws IOException {
        return load(dataset, type).getSize();
    }

    private static String checkDataset(String dataset) {
        if (dataset == null || !DATASET_NAME.matcher(dataset).matches()) {
            throw new IllegalArgumentException("Invalid dataset name: '" + dataset + "'");
        }
        return dataset;
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
