package com.bulkvalidate.app;

import com.bulkvalidate.engine.BatchResult;
import com.bulkvalidate.engine.Outcome;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public class BatchResponse {
    public final int workers;
    public final int count;
    @JsonProperty("elapsed_ms")
    public final long elapsedMs;
    public final boolean partial;
    public final List<Outcome> results;

    @JsonCreator
    public BatchResponse(@JsonProperty("workers") int workers,
                         @JsonProperty("count") int count,
                         @JsonProperty("elapsed_ms") long elapsedMs,
                         @JsonProperty("partial") boolean partial,
                         @JsonProperty("results") List<Outcome> results) {
        this.workers = workers;
        this.count = count;
        this.elapsedMs = elapsedMs;
        this.partial = partial;
        this.results = results == null ? List.of() : List.copyOf(results);
    }

    static BatchResponse from(BatchResult r) {
        return new BatchResponse(r.workers, r.count, r.elapsed.toMillis(), r.partial, r.outcomes);
    }
}
