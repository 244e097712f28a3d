package com.bulkvalidate.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Validates a batch of customer records on a bounded worker pool and returns the outcomes in
 * submission order.
 *
 * <p>Each call builds its own queues and threads: the dispatcher feeds indexed jobs into a bounded
 * task queue, the workers push outcomes into a result queue, and the collector places them by
 * index. Nothing is shared between calls, so one instance can serve concurrent callers.
 */
public class BatchValidator {
    private static final Logger log = LoggerFactory.getLogger(BatchValidator.class);

    private final PoolConfig cfg;
    private final CustomerValidator validator;
    private final SimulatedWorkload workload;

    public BatchValidator(PoolConfig cfg) {
        this(cfg, CustomerValidator.standard(cfg));
    }

    public BatchValidator(PoolConfig cfg, CustomerValidator validator) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.workload = new SimulatedWorkload(cfg.jobDelayMs);
    }

    /**
     * Blocking batch validation. Always returns one outcome per record, {@code result.get(i).index == i}.
     * The worker count is clamped by {@link PoolConfig#resolveWorkers(int)}. Interrupts do not cut
     * the batch short; the thread's interrupt status is restored before returning.
     */
    public List<Outcome> validateBatch(List<CustomerRecord> records, int requestedWorkers) {
        AtomicBoolean interrupted = new AtomicBoolean(Thread.interrupted());
        try {
            return run(records, requestedWorkers, CancellationToken.none(), false, interrupted).outcomes;
        } finally {
            if (interrupted.get()) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /** Like {@link #validateBatch} but gives up on unstarted jobs once {@code timeout} elapses. */
    public BatchResult validate(List<CustomerRecord> records, int requestedWorkers, Duration timeout) {
        return validate(records, requestedWorkers, CancellationToken.withTimeout(timeout));
    }

    /**
     * Runs one batch. If {@code token} is cancelled before the batch finishes, dispatching stops,
     * queued jobs are dropped, in-flight jobs complete, and the result is marked partial. Interrupting
     * the calling thread cancels the token.
     */
    public BatchResult validate(List<CustomerRecord> records, int requestedWorkers, CancellationToken token) {
        return run(records, requestedWorkers, token, true, new AtomicBoolean());
    }

    private BatchResult run(List<CustomerRecord> records, int requestedWorkers, CancellationToken token,
                            boolean interruptible, AtomicBoolean interruptSeen) {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(token, "token");

        int workers = cfg.resolveWorkers(requestedWorkers);
        if (workers != requestedWorkers) {
            log.debug("Requested {} workers, using {}", requestedWorkers, workers);
        }
        if (records.isEmpty()) {
            return BatchResult.empty(workers);
        }

        long startNanos = System.nanoTime();
        int count = records.size();
        BatchStats stats = new BatchStats();

        JobQueue jobs = new JobQueue(cfg.queueCapacityFor(workers));
        BlockingQueue<Outcome> results = new LinkedBlockingQueue<>();
        long pollMs = cfg.effectivePollIntervalMs();
        WorkerPool pool = new WorkerPool(workers, validator, workload, token, stats, pollMs);
        Collector collector = new Collector(count);
        ScheduledExecutorService statsScheduler = startStats(stats, count, startNanos);

        try {
            pool.start(jobs, results);
            Dispatcher dispatcher = new Dispatcher(jobs, token, stats, pollMs, interruptible);
            int placed = dispatcher.dispatch(records);
            if (placed < count) {
                log.info("Batch cancelled during dispatch: {} of {} jobs submitted", placed, count);
            }
            collector.collect(results, pool, token, pollMs, interruptible);
            if (dispatcher.sawInterrupt() || collector.sawInterrupt()) {
                interruptSeen.set(true);
            }
        } finally {
            pool.close(Math.max(1_000L, cfg.jobDelayMs * 2 + pollMs * 2));
            if (statsScheduler != null) {
                statsScheduler.shutdownNow();
            }
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        boolean partial = !collector.isComplete();
        if (partial) {
            log.warn("Batch partial: {} of {} outcomes, {} abandoned, workers={} elapsed={}ms",
                    collector.received(), count, stats.abandoned.sum(), workers, elapsed.toMillis());
        } else {
            log.info("Batch done: count={} valid={} invalid={} workers={} elapsed={}ms",
                    count, stats.valid.sum(), stats.invalid.sum(), workers, elapsed.toMillis());
        }
        if (stats.ruleErrors.sum() > 0) {
            log.warn("{} records failed with a rule error", stats.ruleErrors.sum());
        }
        return new BatchResult(collector.results(), workers, count, elapsed, partial);
    }

    private ScheduledExecutorService startStats(BatchStats stats, int count, long startNanos) {
        if (cfg.statsEverySeconds <= 0) {
            return null;
        }
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("batch-stats");
            return t;
        });
        scheduler.scheduleAtFixedRate(() -> logProgress(stats, count, startNanos),
                cfg.statsEverySeconds, cfg.statsEverySeconds, TimeUnit.SECONDS);
        return scheduler;
    }

    private static void logProgress(BatchStats stats, int count, long startNanos) {
        double seconds = Math.max(1.0, (System.nanoTime() - startNanos) / 1_000_000_000.0);
        long done = stats.completed();
        log.info("Progress: dispatched={} completed={}/{} valid={} invalid={} throughput={} rec/s",
                stats.dispatched.sum(), done, count, stats.valid.sum(), stats.invalid.sum(),
                String.format("%.2f", done / seconds));
    }
}
