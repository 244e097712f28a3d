package com.bulkvalidate.engine;

public class Job {
    public final int index;
    public final CustomerRecord payload;

    Job(int index, CustomerRecord payload) {
        if (index < 0) throw new IllegalArgumentException("index must be >= 0");
        this.index = index;
        this.payload = payload;
    }
}
