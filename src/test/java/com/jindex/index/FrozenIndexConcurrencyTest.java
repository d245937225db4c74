package com.jindex.index;

import com.jindex.registry.IndexFactory;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class FrozenIndexConcurrencyTest {

    @ParameterizedTest
    @EnumSource(value = IndexType.class, names = {"AVL", "RED_BLACK", "HASH_MAP"})
    void shouldServeConcurrentReadersOnceFrozen(IndexType type) throws Exception {
        RatingIndex index = (RatingIndex) new IndexFactory().build(SampleRecords.random(5_000, 77), type);
        int expectedRange = index.getRange(3.0, 7.0).size();
        int expectedSearch = index.search(5.0).size();

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> readers = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                readers.add(() -> {
                    for (int round = 0; round < 50; round++) {
                        if (index.getRange(3.0, 7.0).size() != expectedRange
                            || index.search(5.0).size() != expectedSearch
                            || index.getTopK(5).size() != 5) {
                            return false;
                        }
                    }
                    return true;
                });
            }
            for (Future<Boolean> result : pool.invokeAll(readers)) {
                assertThat(result.get()).isTrue();
            }
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
        }
    }
}
