package com.stratum.core.tree;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ContainerInfoTest {

    private ContainerInfo container(int pending) {
        var info = new ContainerInfo("db:proc.sql:P1:1", "PROCEDURE", "P1", null, 1, 20);
        for (int i = 0; i < pending; i++) {
            info.addPending();
        }
        return info;
    }

    @Test
    @DisplayName("only the decrement reaching zero reports completion")
    void decrementReportsZeroOnce() {
        var info = container(2);
        assertFalse(info.decrementPending());
        assertTrue(info.decrementPending());
        assertFalse(info.decrementPending());
        assertEquals(0, info.pendingCount());
    }

    @Test
    @DisplayName("pending count never goes below zero")
    void neverNegative() {
        var info = container(0);
        assertFalse(info.decrementPending());
        assertEquals(0, info.pendingCount());
    }

    @Test
    @DisplayName("racing decrements report zero exactly once")
    void racingDecrements() throws Exception {
        int n = 200;
        var info = container(n);
        var zeroHits = new AtomicInteger();
        var start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            for (int i = 0; i < n + 50; i++) {
                pool.submit(() -> {
                    start.await();
                    if (info.decrementPending()) {
                        zeroHits.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }
        assertEquals(1, zeroHits.get());
        assertEquals(0, info.pendingCount());
    }

    @Test
    @DisplayName("markFinalized succeeds once")
    void finalizedOnce() {
        var info = container(0);
        assertTrue(info.markFinalized());
        assertFalse(info.markFinalized());
        assertTrue(info.isFinalized());
    }
}
