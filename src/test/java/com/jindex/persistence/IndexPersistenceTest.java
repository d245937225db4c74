package com.jindex.persistence;

import com.jindex.common.compression.CompressionCodec;
import com.jindex.index.IndexType;
import com.jindex.index.PrefixIndex;
import com.jindex.index.RatingIndex;
import com.jindex.index.Record;
import com.jindex.index.RecursionDepthExceededException;
import com.jindex.index.SampleRecords;
import com.jindex.index.ScannableIndex;
import com.jindex.index.StructureNotFoundException;
import com.jindex.registry.IndexFactory;
import com.jindex.tree.BinarySearchTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.*;

public class IndexPersistenceTest {

    @TempDir
    Path tempDir;

    private IndexPersistence persistence;
    private List<Record> records;

    @BeforeEach
    public void setUp() {
        persistence = new IndexPersistence(new PersistenceConfig.Builder().setDirectory(tempDir).build());
        records = SampleRecords.random(300, 21);
    }

    private ScannableIndex build(IndexType type) {
        return new IndexFactory().build(records, type);
    }

    private BinarySearchTree degenerate(int count) {
        BinarySearchTree tree = new BinarySearchTree();
        for (int i = 0; i < count; i++) {
            tree.insert(i, SampleRecords.record(i, "Airline " + i, i));
        }
        return tree;
    }

    @ParameterizedTest
    @EnumSource(IndexType.class)
    public void shouldRestoreEveryStructureExactly(IndexType type) throws IOException {
        ScannableIndex original = build(type);

        SavedIndex saved = persistence.save(original, "airline");
        ScannableIndex restored = persistence.load("airline", type);

        assertEquals("airline_" + type.getToken() + "_index.jix", saved.getFileName());
        assertEquals(Files.size(tempDir.resolve(saved.getFileName())), saved.getSizeBytes());
        assertThat(restored).isInstanceOf(original.getClass());
        assertTrue(restored.isFrozen());
        assertEquals(original.getSize(), restored.getSize());
        assertEquals(original.getHeight(), restored.getHeight());
        assertThat(restored.getAllRecords()).containsExactlyElementsOf(original.getAllRecords());
        assertThat(restored.fieldNames()).isEqualTo(original.fieldNames());

        IndexFileWriter writer = new IndexFileWriter();
        assertThat(writer.serialize(restored)).isEqualTo(writer.serialize(original));
    }

    @ParameterizedTest
    @EnumSource(value = IndexType.class, names = {"BST", "AVL", "RED_BLACK", "DIGIT_TRIE", "HASH_MAP"})
    public void shouldAnswerQueriesAfterRestore(IndexType type) throws IOException {
        RatingIndex original = (RatingIndex) build(type);
        persistence.save(original, "lounge");
        RatingIndex restored = (RatingIndex) persistence.load("lounge", type);

        assertThat(SampleRecords.ids(restored.getRange(2.0, 6.5)))
            .containsExactlyInAnyOrderElementsOf(SampleRecords.ids(original.getRange(2.0, 6.5)));
        assertThat(SampleRecords.ratings(restored.getTopK(15)))
            .containsExactlyElementsOf(SampleRecords.ratings(original.getTopK(15)));
        assertThatThrownBy(() -> restored.insert(1.0, SampleRecords.record(1, "x", 1.0)))
            .isInstanceOf(IllegalStateException.class);
    }

    @ParameterizedTest
    @EnumSource(value = IndexType.class, names = {"CHARACTER_TRIE", "TERNARY_SEARCH_TREE", "SORTED_ARRAY"})
    public void shouldAnswerPrefixQueriesAfterRestore(IndexType type) throws IOException {
        PrefixIndex original = (PrefixIndex) build(type);
        persistence.save(original, "seat");
        PrefixIndex restored = (PrefixIndex) persistence.load("seat", type);

        assertThat(restored.searchPrefix("air", 50).getRecords())
            .containsExactlyElementsOf(original.searchPrefix("air", 50).getRecords());
        assertEquals(original.getMemoryUsage(), restored.getMemoryUsage());
    }

    @ParameterizedTest
    @EnumSource(CompressionCodec.class)
    public void shouldReadArtifactsWrittenWithAnyCodec(CompressionCodec codec) throws IOException {
        IndexPersistence writing = new IndexPersistence(new PersistenceConfig.Builder()
            .setDirectory(tempDir)
            .setCompressionCodec(codec)
            .build());
        writing.save(build(IndexType.AVL), "airport");

        assertEquals(300, persistence.load("airport", IndexType.AVL).getSize());
    }

    @Test
    public void shouldSaveUnderAMatchingStructureName() throws IOException {
        persistence.save(build(IndexType.RED_BLACK), "airline", "Red-Black");

        assertTrue(persistence.exists("airline", IndexType.RED_BLACK));
        assertThrows(IllegalArgumentException.class,
            () -> persistence.save(build(IndexType.AVL), "airline", "bst"));
        assertThrows(StructureNotFoundException.class,
            () -> persistence.save(build(IndexType.AVL), "airline", "b-tree"));
    }

    @Test
    public void shouldRejectUnsafeDatasetNames() {
        assertThrows(IllegalArgumentException.class, () -> persistence.pathFor("../etc", IndexType.BST));
        assertThrows(IllegalArgumentException.class, () -> persistence.pathFor("", IndexType.BST));
        assertThrows(IllegalArgumentException.class, () -> persistence.pathFor(null, IndexType.BST));
    }

    @Test
    public void shouldReportMissingArtifacts() throws IOException {
        persistence.save(build(IndexType.AVL), "airline");

        assertThrows(PersistenceMissingException.class, () -> persistence.load("airline", IndexType.BST));
        assertThrows(PersistenceMissingException.class, () -> persistence.load("seat"));
        assertThrows(PersistenceMissingException.class,
            () -> persistence.load("airline", List.of(IndexType.AVL, IndexType.HASH_MAP)));
    }

    @Test
    public void shouldLoadEverySavedTypeOfADataset() throws IOException {
        persistence.save(build(IndexType.AVL), "airline");
        persistence.save(build(IndexType.SORTED_ARRAY), "airline");
        persistence.save(build(IndexType.BST), "seat");

        Map<IndexType, ScannableIndex> loaded = persistence.load("airline");

        assertThat(loaded.keySet()).containsExactly(IndexType.AVL, IndexType.SORTED_ARRAY);
        assertThat(persistence.load("airline", EnumSet.of(IndexType.AVL)).get(IndexType.AVL).getSize())
            .isEqualTo(300);
    }

    @Test
    public void shouldListArtifactsWithoutLoadingThem() throws IOException {
        persistence.save(build(IndexType.AVL), "airline");
        persistence.save(build(IndexType.BST), "airline");
        persistence.save(build(IndexType.HASH_MAP), "seat_reviews");
        Files.writeString(tempDir.resolve("readme.txt"), "not an index");
        Files.writeString(tempDir.resolve("notes_index.jix"), "not an index either");
        Files.writeString(tempDir.resolve("broken_avl_index.jix"), "garbage");

        Map<String, List<SavedIndex>> saved = persistence.listSaved();

        assertThat(saved.keySet()).containsExactly("airline", "seat_reviews");
        assertThat(saved.get("airline")).extracting(SavedIndex::getType)
            .containsExactly(IndexType.BST, IndexType.AVL);
        assertThat(saved.get("seat_reviews").get(0).getType()).isEqualTo(IndexType.HASH_MAP);
        assertThat(persistence.listSaved("lounge")).isEmpty();
    }

    @Test
    public void shouldListNothingWhenDirectoryIsMissing() throws IOException {
        IndexPersistence nowhere = new IndexPersistence(new PersistenceConfig.Builder()
            .setDirectory(tempDir.resolve("missing"))
            .build());

        assertThat(nowhere.listSaved()).isEmpty();
    }

    @Test
    public void shouldDetectTruncatedArtifacts() throws IOException {
        persistence.save(build(IndexType.RED_BLACK), "airline");
        Path path = persistence.pathFor("airline", IndexType.RED_BLACK);
        byte[] bytes = Files.readAllBytes(path);
        Files.write(path, Arrays.copyOf(bytes, bytes.length - 5));

        assertThrows(PersistenceCorruptException.class, () -> persistence.load("airline", IndexType.RED_BLACK));
        assertThrows(PersistenceCorruptException.class, () -> persistence.verify("airline", IndexType.RED_BLACK));

        Files.write(path, Arrays.copyOf(bytes, 10));
        assertThrows(PersistenceCorruptException.class, () -> persistence.load("airline", IndexType.RED_BLACK));
    }

    @Test
    public void shouldDetectDamagedPayloads() throws IOException {
        IndexPersistence plain = new IndexPersistence(new PersistenceConfig.Builder()
            .setDirectory(tempDir)
            .setCompressionCodec(CompressionCodec.UNCOMPRESSED)
            .build());
        plain.save(build(IndexType.TERNARY_SEARCH_TREE), "airline");
        Path path = plain.pathFor("airline", IndexType.TERNARY_SEARCH_TREE);
        byte[] bytes = Files.readAllBytes(path);
        bytes[bytes.length / 2] ^= 0x5A;
        Files.write(path, bytes);

        assertThatThrownBy(() -> plain.load("airline", IndexType.TERNARY_SEARCH_TREE))
            .isInstanceOf(PersistenceCorruptException.class)
            .hasMessageContaining("Checksum");
    }

    @ParameterizedTest
    @EnumSource(value = CompressionCodec.class, names = {"SNAPPY", "GZIP", "ZSTD"})
    public void shouldReportDamagedCompressedPayloadsAsCorrupt(CompressionCodec codec) throws IOException {
        IndexPersistence compressed = new IndexPersistence(new PersistenceConfig.Builder()
            .setDirectory(tempDir)
            .setCompressionCodec(codec)
            .build());
        compressed.save(build(IndexType.AVL), "airline");
        Path path = compressed.pathFor("airline", IndexType.AVL);
        byte[] bytes = Files.readAllBytes(path);
        Arrays.fill(bytes, IndexFileHeader.SIZE, IndexFileHeader.SIZE + 8, (byte) 0);
        Files.write(path, bytes);

        assertThatThrownBy(() -> compressed.load("airline", IndexType.AVL))
            .isInstanceOf(PersistenceCorruptException.class);
    }

    @ParameterizedTest
    @EnumSource(CompressionCodec.class)
    public void shouldRejectAnInflatedUncompressedLength(CompressionCodec codec) throws IOException {
        IndexPersistence writing = new IndexPersistence(new PersistenceConfig.Builder()
            .setDirectory(tempDir)
            .setCompressionCodec(codec)
            .build());
        writing.save(build(IndexType.AVL), "airline");
        Path path = writing.pathFor("airline", IndexType.AVL);
        byte[] bytes = Files.readAllBytes(path);
        // uncompressed length follows magic, version, type and codec
        ByteBuffer.wrap(bytes).putInt(14, Integer.MAX_VALUE);
        Files.write(path, bytes);

        assertThatThrownBy(() -> writing.load("airline", IndexType.AVL))
            .isInstanceOf(PersistenceCorruptException.class)
            .hasMessageContaining("cannot be decompressed");
    }

    @Test
    public void shouldDetectBadMagic() throws IOException {
        persistence.save(build(IndexType.BST), "airline");
        Path path = persistence.pathFor("airline", IndexType.BST);
        byte[] bytes = Files.readAllBytes(path);
        bytes[0] = 'X';
        Files.write(path, bytes);

        assertThatThrownBy(() -> persistence.load("airline", IndexType.BST))
            .isInstanceOf(PersistenceCorruptException.class)
            .hasMessageContaining("magic");
    }

    @Test
    public void shouldRefuseToSerializeBeyondTheDepthBudget() {
        IndexPersistence shallow = new IndexPersistence(new PersistenceConfig.Builder()
            .setDirectory(tempDir)
            .setMaxTraversalDepth(10)
            .build());

        RecursionDepthExceededException e = assertThrows(RecursionDepthExceededException.class,
            () -> shallow.save(degenerate(50), "airline"));

        assertEquals(11, e.getDepth());
        assertEquals(10, e.getLimit());
        assertFalse(shallow.exists("airline", IndexType.BST));
    }

    @Test
    public void shouldRefuseToRebuildBeyondTheDepthBudget() throws IOException {
        persistence.save(degenerate(50), "airline");
        IndexPersistence shallow = new IndexPersistence(new PersistenceConfig.Builder()
            .setDirectory(tempDir)
            .setMaxTraversalDepth(10)
            .build());

        assertThrows(PersistenceCorruptException.class, () -> shallow.load("airline", IndexType.BST));
    }

    @Test
    public void shouldSerializeDegenerateTreesIteratively() throws IOException {
        persistence.save(degenerate(20_000), "airline");

        assertEquals(20_000, persistence.verify("airline", IndexType.BST));
        assertEquals(20_000, persistence.load("airline", IndexType.BST).getHeight());
    }

    @Test
    public void shouldDeleteArtifacts() throws IOException {
        persistence.save(build(IndexType.DIGIT_TRIE), "airline");

        assertTrue(persistence.delete("airline", IndexType.DIGIT_TRIE));
        assertFalse(persistence.exists("airline", IndexType.DIGIT_TRIE));
        assertFalse(persistence.delete("airline", IndexType.DIGIT_TRIE));
    }
}
