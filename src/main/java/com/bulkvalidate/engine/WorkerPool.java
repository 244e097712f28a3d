package com.bulkvalidate.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A fixed set of worker threads for one batch. Workers take jobs from the {@link JobQueue},
 * validate them and push outcomes to the result queue. They never see each other or the output
 * array.
 */
class WorkerPool {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);
    private static final AtomicInteger POOL_SEQ = new AtomicInteger();

    static final String INTERNAL_ERROR = "internal validation error";

    private final int workers;
    private final CustomerValidator validator;
    private final SimulatedWorkload workload;
    private final CancellationToken token;
    private final BatchStats stats;
    private final long pollIntervalMs;
    private final ExecutorService exec;

    WorkerPool(int workers, CustomerValidator validator, SimulatedWorkload workload,
               CancellationToken token, BatchStats stats, long pollIntervalMs) {
        if (workers <= 0) throw new IllegalArgumentException("workers must be > 0");
        this.workers = workers;
        this.validator = validator;
        this.workload = workload;
        this.token = token;
        this.stats = stats;
        this.pollIntervalMs = pollIntervalMs;

        int poolId = POOL_SEQ.incrementAndGet();
        AtomicInteger threadSeq = new AtomicInteger();
        this.exec = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("validator-" + poolId + "-worker-" + threadSeq.incrementAndGet());
            return t;
        });
    }

    void start(JobQueue jobs, BlockingQueue<Outcome> results) {
        for (int i = 0; i < workers; i++) {
            exec.submit(() -> workerLoop(jobs, results));
        }
        exec.shutdown();
    }

    boolean isTerminated() {
        return exec.isTerminated();
    }

    void close(long graceMs) {
        try {
            if (!exec.awaitTermination(graceMs, TimeUnit.MILLISECONDS)) {
                log.warn("Workers still running after {} ms, interrupting", graceMs);
                exec.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exec.shutdownNow();
        }
    }

    private void workerLoop(JobQueue jobs, BlockingQueue<Outcome> results) {
        while (!jobs.isDrained()) {
            Job job;
            try {
                job = jobs.poll(pollIntervalMs);
                if (job == null) continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            if (token.isCancelled()) {
                stats.abandoned.increment();
                continue;
            }

            workload.perform();
            results.offer(process(job));
        }
    }

    private Outcome process(Job job) {
        Verdict verdict;
        try {
            verdict = validator.validate(job.payload);
        } catch (RuntimeException | Error ex) {
            // one outcome per started job, even when a rule blows up
            stats.ruleErrors.increment();
            log.error("Rule failed on job {}: {}", job.index, ex.toString());
            verdict = Verdict.invalid(INTERNAL_ERROR);
        }

        if (verdict.valid) {
            stats.valid.increment();
        } else {
            stats.invalid.increment();
        }
        return Outcome.of(job, verdict);
    }
}
