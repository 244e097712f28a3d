package com.bulkvalidate.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns the submitted batch into indexed jobs and feeds them to the task queue. Closes the queue
 * when done so idle workers can exit.
 */
class Dispatcher {
    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private static final CustomerRecord EMPTY = new CustomerRecord("", "");

    private final JobQueue jobs;
    private final CancellationToken token;
    private final BatchStats stats;
    private final long pollIntervalMs;
    private final boolean interruptible;
    private boolean interrupted;

    Dispatcher(JobQueue jobs, CancellationToken token, BatchStats stats, long pollIntervalMs,
               boolean interruptible) {
        this.jobs = jobs;
        this.token = token;
        this.stats = stats;
        this.pollIntervalMs = pollIntervalMs;
        this.interruptible = interruptible;
    }

    /**
     * Enqueues one job per record, index = position in {@code records}. Blocks while the queue is
     * full. Stops early if the token is cancelled. An interrupt cancels the token when the
     * dispatcher is interruptible; otherwise it is remembered and dispatching goes on.
     *
     * @return number of jobs placed on the queue
     */
    int dispatch(List<CustomerRecord> records) {
        int placed = 0;
        try {
            for (int i = 0; i < records.size(); i++) {
                CustomerRecord record = records.get(i);
                Job job = new Job(i, record == null ? EMPTY : record);
                if (!enqueue(job)) {
                    log.debug("Dispatch stopped after {} of {} jobs", placed, records.size());
                    break;
                }
                placed++;
                stats.dispatched.increment();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            log.debug("Dispatcher interrupted after {} jobs", placed);
        } finally {
            jobs.close();
        }
        return placed;
    }

    boolean sawInterrupt() {
        return interrupted;
    }

    private boolean enqueue(Job job) throws InterruptedException {
        while (!token.isCancelled()) {
            try {
                if (jobs.offer(job, pollIntervalMs)) {
                    return true;
                }
            } catch (InterruptedException e) {
                if (interruptible) throw e;
                interrupted = true;
            }
        }
        return false;
    }
}
