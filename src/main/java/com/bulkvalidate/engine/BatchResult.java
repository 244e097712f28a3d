package com.bulkvalidate.engine;

import java.time.Duration;
import java.util.List;

public class BatchResult {
    public final List<Outcome> outcomes;
    public final int workers;
    public final int count;
    public final Duration elapsed;
    public final boolean partial;

    BatchResult(List<Outcome> outcomes, int workers, int count, Duration elapsed, boolean partial) {
        this.outcomes = outcomes;
        this.workers = workers;
        this.count = count;
        this.elapsed = elapsed;
        this.partial = partial;
    }

    static BatchResult empty(int workers) {
        return new BatchResult(List.of(), workers, 0, Duration.ZERO, false);
    }
}
