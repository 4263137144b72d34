package com.indexcatalog.checkpoint;

import com.indexcatalog.storage.InMemoryTableStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointerTest {

    private InMemoryTableStore walStore;
    private Checkpointer checkpointer;

    @BeforeEach
    void setUp() {
        walStore = new InMemoryTableStore("wal");
        checkpointer = new Checkpointer(walStore);
    }

    @Test
    void loadIsEmptyBeforeFirstAdvance() throws Exception {
        assertTrue(checkpointer.load().isEmpty());
    }

    @Test
    void advanceMovesForwardOnly() throws Exception {
        assertTrue(checkpointer.advance("2026-01-01T00:00:00.000002_b"));
        assertFalse(checkpointer.advance("2026-01-01T00:00:00.000001_a"));
        assertFalse(checkpointer.advance("2026-01-01T00:00:00.000002_b"));

        CheckpointInfo info = checkpointer.load().orElseThrow();
        assertEquals("2026-01-01T00:00:00.000002_b", info.getEntryId());
        assertTrue(info.getUpdatedAt() > 0);

        assertTrue(checkpointer.advance("2026-01-01T00:00:00.000003_c"));
        assertEquals("2026-01-01T00:00:00.000003_c", checkpointer.load().orElseThrow().getEntryId());
    }

    @Test
    void pointerLivesInItsOwnPartition() throws Exception {
        checkpointer.advance("x");
        assertEquals(List.of(Checkpointer.CHECKPOINT_PARTITION), walStore.partitionKeys());
    }

    @Test
    void concurrentAdvancesSettleOnTheHighestId() throws Exception {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            ids.add(String.format("2026-01-01T00:00:00.%06d_id", i));
        }
        Collections.shuffle(ids);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (String id : ids) {
            futures.add(pool.submit(() -> {
                start.await();
                return checkpointer.advance(id);
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals("2026-01-01T00:00:00.000199_id", checkpointer.load().orElseThrow().getEntryId());
    }
}
