package com.bulkvalidate.engine;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DispatcherTest {

    @Test
    void assignsIndexesInInputOrderAndClosesQueue() throws Exception {
        List<CustomerRecord> records = BatchValidatorTest.mixedBatch(5);
        JobQueue jobs = new JobQueue(10);
        BatchStats stats = new BatchStats();

        int placed = new Dispatcher(jobs, CancellationToken.none(), stats, 10, true).dispatch(records);

        assertEquals(5, placed);
        assertEquals(5, stats.dispatched.sum());
        for (int i = 0; i < 5; i++) {
            Job job = jobs.poll(10);
            assertNotNull(job);
            assertEquals(i, job.index);
            assertSame(records.get(i), job.payload);
        }
        assertTrue(jobs.isDrained());
    }

    @Test
    void blocksOnFullQueueUntilConsumerTakes() throws Exception {
        JobQueue jobs = new JobQueue(1);
        List<Integer> taken = new ArrayList<>();
        CountDownLatch done = new CountDownLatch(1);

        Thread consumer = new Thread(() -> {
            try {
                while (!jobs.isDrained()) {
                    Job j = jobs.poll(10);
                    if (j != null) {
                        taken.add(j.index);
                        Thread.sleep(5);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            done.countDown();
        });
        consumer.start();

        int placed = new Dispatcher(jobs, CancellationToken.none(), new BatchStats(), 10, true)
                .dispatch(BatchValidatorTest.mixedBatch(20));

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(20, placed);
        assertEquals(20, taken.size());
        for (int i = 0; i < 20; i++) {
            assertEquals(i, taken.get(i));
        }
    }

    @Test
    void stopsWhenCancelledWhileQueueIsFull() throws Exception {
        JobQueue jobs = new JobQueue(2);
        CancellationToken token = CancellationToken.withTimeout(Duration.ofMillis(100));

        int placed = new Dispatcher(jobs, token, new BatchStats(), 10, true)
                .dispatch(BatchValidatorTest.mixedBatch(10));

        assertEquals(2, placed);
        assertNotNull(jobs.poll(10));
        assertNotNull(jobs.poll(10));
        assertTrue(jobs.isDrained());
    }

    @Test
    void interruptCancelsWhenInterruptible() {
        CancellationToken token = CancellationToken.create();
        Thread.currentThread().interrupt();

        int placed = new Dispatcher(new JobQueue(10), token, new BatchStats(), 10, true)
                .dispatch(BatchValidatorTest.mixedBatch(5));

        assertTrue(Thread.interrupted());
        assertEquals(0, placed);
        assertTrue(token.isCancelled());
    }

    @Test
    void interruptIsRememberedButIgnoredWhenUninterruptible() {
        CancellationToken token = CancellationToken.create();
        Dispatcher dispatcher = new Dispatcher(new JobQueue(10), token, new BatchStats(), 10, false);
        Thread.currentThread().interrupt();

        int placed = dispatcher.dispatch(BatchValidatorTest.mixedBatch(5));

        assertFalse(Thread.interrupted());
        assertEquals(5, placed);
        assertTrue(dispatcher.sawInterrupt());
        assertFalse(token.isCancelled());
    }
}
