package com.pulse.telemetry.id;

import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class IdGeneratorTest {

    @Test
    void spanIdIs32LowercaseHex() {
        String id = IdGenerator.getInstance().generateSpanId();

        assertEquals(32, id.length());
        assertTrue(id.matches("[0-9a-f]{32}"), id);
    }

    @Test
    void idsAreUniqueAcrossThreads() throws InterruptedException {
        int threads = 8;
        int perThread = 5_000;
        Set<String> ids = ConcurrentHashMap.newKeySet();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);

        for (int t = 0; t < threads; t++) {
            pool.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < perThread; i++) {
                    ids.add(IdGenerator.getInstance().generateSpanId());
                }
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));

        assertEquals(threads * perThread, ids.size());
    }

    @Test
    void taskIdUsesUuidLayout() {
        String id = IdGenerator.getInstance().generateTaskId();

        assertTrue(id.matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}"), id);
    }

    @Test
    void consecutiveIdsDiffer() {
        IdGenerator ids = IdGenerator.getInstance();
        assertNotEquals(ids.generateSpanId(), ids.generateSpanId());
        assertNotEquals(ids.generateTaskId(), ids.generateTaskId());
    }
}
