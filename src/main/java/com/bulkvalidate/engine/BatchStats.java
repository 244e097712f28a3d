package com.bulkvalidate.engine;

import java.util.concurrent.atomic.LongAdder;

public class BatchStats {
    public final LongAdder dispatched = new LongAdder();
    public final LongAdder valid = new LongAdder();
    public final LongAdder invalid = new LongAdder();
    public final LongAdder abandoned = new LongAdder();   // queued but dropped after cancellation
    public final LongAdder ruleErrors = new LongAdder();

    public BatchStats() {}

    public long completed() {
        return valid.sum() + invalid.sum();
    }
}
