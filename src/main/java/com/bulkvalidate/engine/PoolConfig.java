package com.bulkvalidate.engine;

public class PoolConfig {
    static final int WORKER_LIMIT = 20;   // hard cap, whatever the config says

    public int minWorkers = 1;
    public int maxWorkers = WORKER_LIMIT;
    public int defaultWorkers = 5;
    public long jobDelayMs = 120;       // simulated per-job cost
    public int queueCapacity = 0;       // 0 => one slot per worker
    public long pollIntervalMs = 50;
    public int statsEverySeconds = 5;   // 0 disables progress logging
    public int maxEmailLength = 150;
    public String blockedDomain = "example.com";

    public PoolConfig() {}

    /** Maps a caller-requested worker count onto [1, 20] and the configured bounds. Never fails. */
    public int resolveWorkers(int requested) {
        if (requested <= 0) {
            return clamp(defaultWorkers);
        }
        return clamp(requested);
    }

    int queueCapacityFor(int workers) {
        return queueCapacity > 0 ? queueCapacity : workers;
    }

    long effectivePollIntervalMs() {
        return Math.max(1L, pollIntervalMs);
    }

    private int clamp(int n) {
        int lo = Math.min(WORKER_LIMIT, Math.max(1, minWorkers));
        int hi = Math.min(WORKER_LIMIT, Math.max(lo, maxWorkers));
        return Math.min(hi, Math.max(lo, n));
    }
}
