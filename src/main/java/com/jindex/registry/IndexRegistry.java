package com.jindex.registry;

import com.jindex.index.IndexType;
import com.jindex.index.PrefixIndex;
import com.jindex.index.RatingIndex;
import com.jindex.index.ScannableIndex;
import com.jindex.index.StructureNotFoundException;
import com.jindex.persistence.IndexPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cache of frozen structures per (dataset, structure type). Structures are
 * either registered after a build or loaded from persistence on first use.
 * Safe for concurrent readers.
 */
public class IndexRegistry implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(IndexRegistry.class);

    private final IndexPersistence persistence;
    private final Map<Key, ScannableIndex> indexes = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public IndexRegistry(IndexPersistence persistence) {
        this.persistence = Objects.requireNonNull(persistence, "persistence");
    }

    /**
     * Returns the cached structure, loading it from persistence if needed.
     *
     * @throws com.jindex.persistence.PersistenceMissingException If it is neither cached nor saved
     * @throws com.jindex.persistence.PersistenceCorruptException If the saved artifact cannot be restored
     */
    public ScannableIndex get(String dataset, IndexType type) throws IOException {
        checkOpen();
        Key key = new Key(dataset, type);
        ScannableIndex cached = indexes.get(key);
        if (cached != null) {
            return cached;
        }
        ScannableIndex loaded = persistence.load(dataset, type);
        ScannableIndex raced = indexes.putIfAbsent(key, loaded);
        if (raced != null) {
            return raced;
        }
        logger.info("Cached {} index for dataset {} from storage", type.getToken(), dataset);
        return loaded;
    }

    /**
     * Looks a structure up by name, for example {@code "AVL"} or {@code "red_black"}.
     *
     * @throws StructureNotFoundException If the name matches no structure type
     */
    public ScannableIndex get(String dataset, String structureName) throws IOException {
        return get(dataset, IndexType.fromName(structureName));
    }

    /**
     * @throws StructureNotFoundException If the type is not keyed by rating
     */
    public RatingIndex ratingIndex(String dataset, IndexType type) throws IOException {
        ScannableIndex index = get(dataset, type);
        if (!(index instanceof RatingIndex)) {
            throw new StructureNotFoundException(type.getToken() + " is not a rating index");
        }
        return (RatingIndex) index;
    }

    /**
     * @throws StructureNotFoundException If the type is not a name index
     */
    public PrefixIndex prefixIndex(String dataset, IndexType type) throws IOException {
        ScannableIndex index = get(dataset, type);
        if (!(index instanceof PrefixIndex)) {
            throw new StructureNotFoundException(type.getToken() + " is not a prefix index");
        }
        return (PrefixIndex) index;
    }

    /**
     * Returns a structure only if it is already cached.
     */
    public Optional<ScannableIndex> cached(String dataset, IndexType type) {
        return Optional.ofNullable(indexes.get(new Key(dataset, type)));
    }

    /**
     * Caches a built structure, freezing it, and replaces any previous one.
     */
    public void register(String dataset, ScannableIndex index) {
        checkOpen();
        index.freeze();
        indexes.put(new Key(dataset, index.type()), index);
        logger.info("Registered {} index for dataset {} ({} records)",
            index.type().getToken(), dataset, index.getSize());
    }

    public boolean evict(String dataset, IndexType type) {
        boolean evicted = indexes.remove(new Key(dataset, type)) != null;
        if (evicted) {
            logger.info("Evicted {} index for dataset {}", type.getToken(), dataset);
        }
        return evicted;
    }

    /**
     * Evicts every structure of the dataset.
     *
     * @return Number of structures evicted
     */
    public int evict(String dataset) {
        int evicted = 0;
        for (IndexType type : IndexType.values()) {
            if (evict(dataset, type)) {
                evicted++;
            }
        }
        return evicted;
    }

    public int size() {
        return indexes.size();
    }

    public void clear() {
        indexes.clear();
    }

    @Override
    public void close() {
        closed = true;
        clear();
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Registry is closed");
        }
    }

    private static final class Key {
        private final String dataset;
        private final IndexType type;

        Key(String dataset, IndexType type) {
            this.dataset = Objects.requireNonNull(dataset, "dataset");
            this.type = Objects.requireNonNull(type, "type");
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Key)) {
                return false;
            }
            Key other = (Key) o;
            return dataset.equals(other.dataset) && type == other.type;
        }

        @Override
        public int hashCode() {
            return Objects.hash(dataset, type);
        }
    }
}
