package com.jindex.tree;

import com.jindex.index.Record;
import com.jindex.index.SampleRecords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.*;

public class RedBlackTreeTest {

    private RedBlackTree tree;

    @BeforeEach
    public void setUp() {
        tree = new RedBlackTree();
    }

    /**
     * Checks colouring and parent links below {@code slot}, returning the
     * black-height including the sentinel.
     */
    private int checkRedBlack(int slot) {
        if (slot == RedBlackTree.NIL) {
            assertTrue(tree.isBlack(slot), "sentinel must be black");
            return 1;
        }
        int left = tree.leftOf(slot);
        int right = tree.rightOf(slot);
        if (!tree.isBlack(slot)) {
            assertTrue(tree.isBlack(left), "red node " + tree.keyOf(slot) + " has a red left child");
            assertTrue(tree.isBlack(right), "red node " + tree.keyOf(slot) + " has a red right child");
        }
        if (left != RedBlackTree.NIL) {
            assertEquals(slot, tree.parentOf(left));
            assertThat(tree.keyOf(left)).isLessThanOrEqualTo(tree.keyOf(slot));
        }
        if (right != RedBlackTree.NIL) {
            assertEquals(slot, tree.parentOf(right));
            assertThat(tree.keyOf(right)).isGreaterThanOrEqualTo(tree.keyOf(slot));
        }
        int leftHeight = checkRedBlack(left);
        int rightHeight = checkRedBlack(right);
        assertEquals(leftHeight, rightHeight, "black-height differs below " + tree.keyOf(slot));
        return leftHeight + (tree.isBlack(slot) ? 1 : 0);
    }

    private void checkInvariants() {
        assertTrue(tree.isBlack(tree.rootSlot()), "root must be black");
        assertEquals(RedBlackTree.NIL, tree.parentOf(tree.rootSlot()));
        checkRedBlack(tree.rootSlot());
    }

    @ParameterizedTest
    @ValueSource(longs = {1, 5, 8, 13, 2024})
    public void shouldKeepInvariantsAfterEveryInsertion(long seed) {
        List<Record> records = SampleRecords.random(300, seed);
        for (Record record : records) {
            tree.insert(record);
            checkInvariants();
        }
        assertThat(tree.keysInOrder()).hasSize(300).isSorted();
    }

    @Test
    public void shouldBoundHeightOnSortedInput() {
        int count = 4095;
        for (int i = 0; i < count; i++) {
            tree.insert(i, SampleRecords.record(i, "Seat " + i, i));
        }

        checkInvariants();
        double bound = 2 * (Math.log(count + 1) / Math.log(2));
        assertThat((double) tree.getHeight()).isLessThanOrEqualTo(bound);
        assertThat(tree.getRange(10, 19)).hasSize(10);
    }

    @Test
    public void shouldKeepDuplicatesSearchable() {
        for (int i = 0; i < 64; i++) {
            tree.insert(7.5, SampleRecords.record(i, "Dup " + i, 7.5));
        }
        tree.insertAll(SampleRecords.withRatings(1.0, 9.0));

        checkInvariants();
        assertThat(tree.search(7.5)).hasSize(64);
        assertThat(tree.getRange(7.5, 7.5)).hasSize(64);
        assertEquals(66, tree.getSize());
    }

    @Test
    public void shouldColourFirstNodeBlack() {
        tree.insertAll(SampleRecords.withRatings(4.0));

        assertTrue(tree.isBlack(tree.rootSlot()));
        assertEquals(1, tree.getHeight());
        assertEquals(0, new RedBlackTree().getHeight());
    }
}
