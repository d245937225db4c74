package com.jindex.index;

import java.util.Locale;

/**
 * Every structure the engine can build, query and persist.
 */
public enum IndexType {
    BST(1, "bst", false),
    AVL(2, "avl", false),
    RED_BLACK(3, "red_black", false),
    DIGIT_TRIE(4, "digit_trie", false),
    CHARACTER_TRIE(5, "character_trie", true),
    TERNARY_SEARCH_TREE(6, "ternary_search_tree", true),
    SORTED_ARRAY(7, "sorted_array", true),
    HASH_MAP(8, "hash_map", false);

    private final int code;
    private final String token;
    private final boolean nameIndex;

    IndexType(int code, String token, boolean nameIndex) {
        this.code = code;
        this.token = token;
        this.nameIndex = nameIndex;
    }

    /**
     * Stable code written into persisted artifacts.
     */
    public int getCode() {
        return code;
    }

    /**
     * Lower-case token used in artifact file names.
     */
    public String getToken() {
        return token;
    }

    /**
     * True for structures keyed by a name string rather than the rating.
     */
    public boolean isNameIndex() {
        return nameIndex;
    }

    public static IndexType fromCode(int code) {
        for (IndexType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown index type code: " + code);
    }

    /**
     * Resolves a structure name as callers spell it: the enum name, the file
     * token, or a display name such as "Red-Black" or "HashMap".
     *
     * @throws StructureNotFoundException If nothing matches
     */
    public static IndexType fromName(String name) {
        if (name != null) {
            String wanted = name.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
            String compact = wanted.replace("_", "");
            for (IndexType type : values()) {
                if (type.token.equals(wanted) || type.token.replace("_", "").equals(compact)) {
                    return type;
                }
            }
            if (compact.equals("trie")) {
                return DIGIT_TRIE;
            }
            if (compact.equals("tst")) {
                return TERNARY_SEARCH_TREE;
            }
        }
        throw new StructureNotFoundException("Unknown structure type: " + name);
    }
}
