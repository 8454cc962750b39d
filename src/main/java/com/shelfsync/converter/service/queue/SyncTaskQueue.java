package com.shelfsync.converter.service.queue;

import com.shelfsync.converter.model.SyncTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO of sync tasks with admission control.
 *
 * <p>A task key stays reserved from {@link #enqueue} until the worker calls {@link #complete},
 * so a second request for a pending or active key is reported as a duplicate. Only pending
 * tasks count against the capacity.
 */
public class SyncTaskQueue {
    private static final Logger log = LoggerFactory.getLogger(SyncTaskQueue.class);

    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Deque<SyncTask> pending = new ArrayDeque<>();
    private final Map<SyncTask.Key, SyncTask> inFlight = new HashMap<>();

    private final AtomicLong enqueued = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    public SyncTaskQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("queue capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    /** @throws QueueFullException when {@code capacity} tasks are already pending */
    public EnqueueResult enqueue(SyncTask task) {
        lock.lock();
        try {
            SyncTask existing = inFlight.get(task.key());
            if (existing != null) {
                duplicates.incrementAndGet();
                log.debug("Duplicate sync request for {} (task {} is {})", task.key(), existing.getId(), existing.getState().code());
                return new EnqueueResult(EnqueueResult.Status.DUPLICATE, existing);
            }
            if (pending.size() >= capacity) {
                rejected.incrementAndGet();
                throw new QueueFullException(capacity);
            }
            pending.addLast(task);
            inFlight.put(task.key(), task);
            enqueued.incrementAndGet();
            notEmpty.signal();
            log.info("Accepted sync task {} for {} (queue depth {})", task.getId(), task.getParser_name(), pending.size());
            return new EnqueueResult(EnqueueResult.Status.ACCEPTED, task);
        } finally {
            lock.unlock();
        }
    }

    /** Oldest pending task, or null if none arrives within the timeout. */
    public SyncTask poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (pending.isEmpty()) {
                if (nanos <= 0) return null;
                nanos = notEmpty.awaitNanos(nanos);
            }
            return pending.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /** Releases the task's key so an identical request is accepted again. */
    public void complete(SyncTask task) {
        lock.lock();
        try {
            inFlight.remove(task.key(), task);
        } finally {
            lock.unlock();
        }
    }

    public int depth() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() { return capacity; }
    public long enqueuedCount() { return enqueued.get(); }
    public long duplicateCount() { return duplicates.get(); }
    public long rejectedCount() { return rejected.get(); }
}
