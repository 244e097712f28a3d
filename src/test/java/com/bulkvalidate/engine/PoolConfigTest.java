package com.bulkvalidate.engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class PoolConfigTest {

    @Test
    void nonPositiveRequestFallsBackToDefault() {
        PoolConfig cfg = new PoolConfig();
        assertEquals(5, cfg.resolveWorkers(0));
        assertEquals(5, cfg.resolveWorkers(-3));
        assertEquals(5, cfg.resolveWorkers(Integer.MIN_VALUE));
    }

    @Test
    void requestAboveMaxIsClamped() {
        PoolConfig cfg = new PoolConfig();
        assertEquals(20, cfg.resolveWorkers(21));
        assertEquals(20, cfg.resolveWorkers(Integer.MAX_VALUE));
    }

    @Test
    void requestInRangeIsUsedAsIs() {
        PoolConfig cfg = new PoolConfig();
        for (int n = 1; n <= 20; n++) {
            assertEquals(n, cfg.resolveWorkers(n));
        }
    }

    @Test
    void misconfiguredBoundsStillYieldAtLeastOneWorker() {
        PoolConfig cfg = new PoolConfig();
        cfg.minWorkers = 0;
        cfg.maxWorkers = 0;
        cfg.defaultWorkers = 0;
        assertEquals(1, cfg.resolveWorkers(0));
        assertEquals(1, cfg.resolveWorkers(7));
    }

    @Test
    void configuredBoundsCannotExceedTwenty() {
        PoolConfig cfg = new PoolConfig();
        cfg.maxWorkers = 50;
        cfg.defaultWorkers = 40;
        assertEquals(20, cfg.resolveWorkers(30));
        assertEquals(20, cfg.resolveWorkers(0));

        cfg.minWorkers = 25;
        assertEquals(20, cfg.resolveWorkers(1));
    }

    @Test
    void tighterConfiguredBoundsAreHonoured() {
        PoolConfig cfg = new PoolConfig();
        cfg.maxWorkers = 8;
        cfg.defaultWorkers = 12;
        assertEquals(8, cfg.resolveWorkers(15));
        assertEquals(8, cfg.resolveWorkers(-1));
    }

    @Test
    void pollIntervalIsAtLeastOneMillisecond() {
        PoolConfig cfg = new PoolConfig();
        cfg.pollIntervalMs = 0;
        assertEquals(1, cfg.effectivePollIntervalMs());
        cfg.pollIntervalMs = -20;
        assertEquals(1, cfg.effectivePollIntervalMs());
        cfg.pollIntervalMs = 75;
        assertEquals(75, cfg.effectivePollIntervalMs());
    }

    @Test
    void queueCapacityDefaultsToWorkerCount() {
        PoolConfig cfg = new PoolConfig();
        assertEquals(4, cfg.queueCapacityFor(4));
        cfg.queueCapacity = 64;
        assertEquals(64, cfg.queueCapacityFor(4));
    }
}
