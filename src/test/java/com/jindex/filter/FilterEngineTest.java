package com.jindex.filter;

import com.jindex.index.RatingIndex;
import com.jindex.index.SampleRecords;
import com.jindex.index.StructureNotFoundException;
import com.jindex.trie.CharacterTrie;
import com.jindex.tree.AvlTree;
import com.jindex.tree.BinarySearchTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class FilterEngineTest {

    private RatingIndex index;

    @BeforeEach
    void setUp() {
        index = new AvlTree();
        // ids 0..9: country cycles US, UK, DE; reviews = id * 10; recommended when id is even
        index.insertAll(SampleRecords.withRatings(1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0, 8.0, 9.0, 10.0));
    }

    @Test
    void shouldScanEveryRecordForAFieldFilter() {
        List<Map<String, Object>> us = index.filterByField("country", FieldPredicate.equalTo("US"));

        assertThat(SampleRecords.ids(us)).containsExactlyInAnyOrder(0, 3, 6, 9);
        assertThat(index.filterByField("reviews", FieldPredicate.greaterThan(70))).hasSize(2);
        assertThat(index.filterByField("name", FieldPredicate.contains("delta"))).isNotEmpty();
    }

    @Test
    void shouldFailForAFieldNoRecordCarries() {
        assertThatThrownBy(() -> index.filterByField("seat_type", FieldPredicate.equalTo("Economy")))
            .isInstanceOf(StructureNotFoundException.class)
            .hasMessageContaining("seat_type");
    }

    @Test
    void shouldAcceptAnyFieldOnlyWhileTheIndexIsEmpty() {
        BinarySearchTree empty = new BinarySearchTree();
        FilterCriteria criteria = new FilterCriteria.Builder()
            .addField("seat_type", FieldPredicate.equalTo("x"))
            .build();

        assertThat(empty.filterByField("seat_type", FieldPredicate.equalTo("x"))).isEmpty();
        assertThat(empty.filterMultiCriteria(criteria)).isEmpty();

        empty.insert(3.0, SampleRecords.record(1, "Delta", 3.0));
        assertThatThrownBy(() -> empty.filterByField("seat_type", FieldPredicate.equalTo("x")))
            .isInstanceOf(StructureNotFoundException.class);
    }

    @Test
    void shouldApplyRatingFirstThenEachFieldInTurn() {
        FilterCriteria criteria = new FilterCriteria.Builder()
            .setRating(3.0, 9.0)
            .addField("country", FieldPredicate.equalTo("US"))
            .addField("reviews", FieldPredicate.lessThan(80))
            .build();

        assertThat(SampleRecords.ids(index.filterMultiCriteria(criteria))).containsExactlyInAnyOrder(3, 6);
    }

    @Test
    void shouldScanAllRecordsWithoutARatingFilter() {
        FilterCriteria criteria = new FilterCriteria.Builder()
            .addField("recommended", FieldPredicate.equalTo(true))
            .build();

        assertThat(SampleRecords.ids(index.filterMultiCriteria(criteria))).containsExactlyInAnyOrder(0, 2, 4, 6, 8);
    }

    @Test
    void shouldRejectUnknownFieldsBeforeFiltering() {
        FilterCriteria criteria = new FilterCriteria.Builder()
            .setRating(null, 5.0)
            .addField("cabin", FieldPredicate.equalTo("First"))
            .build();

        assertThatThrownBy(() -> index.filterMultiCriteria(criteria)).isInstanceOf(StructureNotFoundException.class);
        assertThatThrownBy(() -> new FilterCriteria.Builder()
            .addField("country", FieldPredicate.equalTo("US"))
            .addField("country", FieldPredicate.equalTo("UK")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldFilterNameIndexesByField() {
        CharacterTrie trie = new CharacterTrie();
        trie.insert("Delta", SampleRecords.record(0, "Delta", 4.0));
        trie.insert("Emirates", SampleRecords.record(1, "Emirates", 5.0));

        assertThat(SampleRecords.ids(trie.filterByField("rating", FieldPredicate.between(4.5, 5.0))))
            .containsExactly(1);
    }
}
