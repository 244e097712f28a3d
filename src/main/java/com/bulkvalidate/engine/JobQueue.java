package com.bulkvalidate.engine;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

class JobQueue {
    private final BlockingQueue<Job> queue;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    JobQueue(int capacity) {
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    // full queue => backpressure on the producer
    boolean offer(Job job, long timeoutMs) throws InterruptedException {
        if (closed.get()) throw new IllegalStateException("job queue is closed");
        return queue.offer(job, timeoutMs, TimeUnit.MILLISECONDS);
    }

    Job poll(long timeoutMs) throws InterruptedException {
        return queue.poll(timeoutMs, TimeUnit.MILLISECONDS);
    }

    void close() {
        closed.set(true);
    }

    // closed and empty: workers may exit
    boolean isDrained() {
        return closed.get() && queue.isEmpty();
    }
}
