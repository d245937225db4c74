package com.jindex.trie;

import com.jindex.index.InvalidKeyException;
import com.jindex.index.PrefixSearchResult;
import com.jindex.index.SampleRecords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class CharacterTrieTest {

    private CharacterTrie trie;

    private static List<Object> names(List<Map<String, Object>> records) {
        return records.stream().map(r -> r.get("name")).collect(Collectors.toList());
    }

    private void add(int id, String name) {
        trie.insert(name, SampleRecords.record(id, name, 4.0));
    }

    @BeforeEach
    void setUp() {
        trie = new CharacterTrie();
        add(1, "Delta");
        add(2, "delta air");
        add(3, "Deltaone");
        add(4, "United");
    }

    @Test
    void shouldCollectEveryNameBelowThePrefix() {
        PrefixSearchResult result = trie.searchPrefix("DEL");

        assertThat(names(result.getRecords())).containsExactly("Delta", "delta air", "Deltaone");
        assertThat(result.getMetrics().getResultCount()).isEqualTo(3);
    }

    @Test
    void shouldNormalizeThePrefix() {
        assertThat(trie.searchPrefix("  dElTa ", 10).size()).isEqualTo(3);
        assertThat(trie.searchPrefix("united", 10).size()).isEqualTo(1);
    }

    @Test
    void shouldReturnNothingForUnknownOrBlankPrefixes() {
        assertThat(trie.searchPrefix("deltax", 10).getRecords()).isEmpty();
        PrefixSearchResult blank = trie.searchPrefix("   ", 10);
        assertThat(blank.getRecords()).isEmpty();
        assertThat(blank.getMetrics().getComparisons()).isZero();
    }

    @Test
    void shouldTruncateToMaxResults() {
        assertThat(names(trie.searchPrefix("d", 2).getRecords())).containsExactly("Delta", "delta air");
    }

    @Test
    void shouldRejectBlankNames() {
        assertThatThrownBy(() -> trie.insert("  ", SampleRecords.record(9, "", 1.0)))
            .isInstanceOf(InvalidKeyException.class);
        assertThatThrownBy(() -> trie.insert(null, SampleRecords.record(9, "", 1.0)))
            .isInstanceOf(InvalidKeyException.class);
        assertThat(trie.getSize()).isEqualTo(4);
    }

    @Test
    void shouldKeepEveryRecordOfADuplicateName() {
        add(5, "DELTA");

        assertThat(trie.searchPrefix("delta", 10).size()).isEqualTo(4);
        assertThat(trie.getSize()).isEqualTo(5);
        assertThat(trie.getHeight()).isEqualTo("delta air".length());
    }
}
