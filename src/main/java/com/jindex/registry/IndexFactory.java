package com.jindex.registry;

import com.jindex.hash.BucketHashMap;
import com.jindex.index.IndexType;
import com.jindex.index.PrefixIndex;
import com.jindex.index.RatingIndex;
import com.jindex.index.Record;
import com.jindex.index.ScannableIndex;
import com.jindex.prefix.SortedArrayIndex;
import com.jindex.prefix.TernarySearchTree;
import com.jindex.tree.AvlTree;
import com.jindex.tree.BinarySearchTree;
import com.jindex.tree.RedBlackTree;
import com.jindex.trie.CharacterTrie;
import com.jindex.trie.DigitTrie;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds index structures from a dataset's records in one pass. Rating
 * structures are keyed by each record's rating, name structures by the
 * configured name field.
 */
public class IndexFactory {
    private static final Logger logger = LoggerFactory.getLogger(IndexFactory.class);

    public static final String DEFAULT_NAME_FIELD = "name";

    static final Map<String, String> DEFAULT_NAME_FIELDS = Map.of(
        "airline", "airline_name",
        "airport", "airport_name",
        "lounge", "lounge_name",
        "seat", "airline_name");

    private final String nameField;

    public IndexFactory() {
        this(DEFAULT_NAME_FIELD);
    }

    public IndexFactory(String nameField) {
        this.nameField = Objects.requireNonNull(nameField, "nameField");
    }

    /**
     * Factory using the usual name field of a dataset, {@code name} for
     * datasets without one.
     */
    public static IndexFactory forDataset(String dataset) {
        return new IndexFactory(DEFAULT_NAME_FIELDS.getOrDefault(dataset, DEFAULT_NAME_FIELD));
    }

    public String getNameField() {
        return nameField;
    }

    /**
     * @return A new, empty structure of the given type
     */
    public static ScannableIndex create(IndexType type) {
        return switch (type) {
            case BST -> new BinarySearchTree();
            case AVL -> new AvlTree();
            case RED_BLACK -> new RedBlackTree();
            case DIGIT_TRIE -> new DigitTrie();
            case CHARACTER_TRIE -> new CharacterTrie();
            case TERNARY_SEARCH_TREE -> new TernarySearchTree();
            case SORTED_ARRAY -> new SortedArrayIndex();
            case HASH_MAP -> new BucketHashMap();
        };
    }

    /**
     * Inserts every record into a fresh structure of each requested type and
     * freezes the results. Records without a usable name are left out of
     * name structures only.
     *
     * @throws com.jindex.index.InvalidKeyException If a name is present but blank
     */
    public Map<IndexType, ScannableIndex> build(List<Record> records, Collection<IndexType> types) {
        Map<IndexType, ScannableIndex> built = new EnumMap<>(IndexType.class);
        for (IndexType type : types) {
            built.put(type, create(type));
        }
        int unnamed = 0;
        for (Record record : records) {
            Object name = record.getValue().get(nameField);
            if (!(name instanceof String)) {
                unnamed++;
            }
            for (ScannableIndex index : built.values()) {
                if (index instanceof RatingIndex) {
                    ((RatingIndex) index).insert(record);
                } else if (name instanceof String) {
                    ((PrefixIndex) index).insert((String) name, record.getValue());
                }
            }
        }
        for (ScannableIndex index : built.values()) {
            index.freeze();
        }
        if (unnamed > 0) {
            logger.debug("{} of {} records have no '{}' field", unnamed, records.size(), nameField);
        }
        return built;
    }

    public ScannableIndex build(List<Record> records, IndexType type) {
        return build(records, List.of(type)).get(type);
    }
}
