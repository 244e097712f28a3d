package com.bulkvalidate.engine;

// fixed per-job delay standing in for real validation cost
public class SimulatedWorkload {
    private final long delayMs;

    public SimulatedWorkload(long delayMs) {
        if (delayMs < 0) throw new IllegalArgumentException("delayMs must be >= 0");
        this.delayMs = delayMs;
    }

    public void perform() {
        if (delayMs == 0) return;
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            // finish the job anyway; the pool notices the flag on its next poll
            Thread.currentThread().interrupt();
        }
    }
}
