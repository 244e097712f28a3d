package com.bulkvalidate.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Reassembles outcomes, which arrive in completion order, into submission order. Terminates on
 * the number of outcomes received; the pool stopping only ends a batch that came up short.
 */
class Collector {
    private static final Logger log = LoggerFactory.getLogger(Collector.class);

    private final int expected;
    private final Outcome[] slots;
    private int received;
    private boolean interrupted;

    Collector(int expected) {
        if (expected < 0) throw new IllegalArgumentException("expected must be >= 0");
        this.expected = expected;
        this.slots = new Outcome[expected];
    }

    /**
     * Blocks until {@code expected} outcomes arrived or the pool has stopped, whichever is first.
     * After a cancellation the pool stops once its in-flight jobs are done; whatever they produced
     * is kept. When {@code interruptible} is false an interrupt is remembered and waiting goes on.
     */
    void collect(BlockingQueue<Outcome> results, WorkerPool pool, CancellationToken token,
                 long pollIntervalMs, boolean interruptible) {
        while (received < expected) {
            Outcome o;
            try {
                o = results.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                if (!interruptible) {
                    interrupted = true;
                    continue;
                }
                Thread.currentThread().interrupt();
                token.cancel();
                drain(results);
                log.debug("Collector interrupted with {} of {} outcomes", received, expected);
                return;
            }
            if (o != null) {
                place(o);
                continue;
            }
            if (pool.isTerminated()) {
                drain(results);
                if (received < expected && !token.isCancelled()) {
                    log.error("Workers stopped with {} of {} outcomes", received, expected);
                }
                return;
            }
        }
    }

    boolean sawInterrupt() {
        return interrupted;
    }

    void place(Outcome o) {
        if (o.index < 0 || o.index >= expected) {
            throw new IllegalStateException("outcome index out of range: " + o.index);
        }
        if (slots[o.index] != null) {
            throw new IllegalStateException("duplicate outcome for index " + o.index);
        }
        slots[o.index] = o;
        received++;
    }

    boolean isComplete() {
        return received == expected;
    }

    int received() {
        return received;
    }

    // missing slots are skipped when the batch was cut short
    List<Outcome> results() {
        if (isComplete()) {
            return Collections.unmodifiableList(Arrays.asList(slots));
        }
        List<Outcome> out = new ArrayList<>(received);
        for (Outcome o : slots) {
            if (o != null) out.add(o);
        }
        return Collections.unmodifiableList(out);
    }

    private void drain(BlockingQueue<Outcome> results) {
        List<Outcome> rest = new ArrayList<>();
        results.drainTo(rest);
        rest.stream().filter(Objects::nonNull).forEach(this::place);
    }
}
