package com.shelfsync.converter.service.queue;

import com.shelfsync.converter.dto.SyncDtos;
import com.shelfsync.converter.model.SyncTask;
import com.shelfsync.converter.service.sync.BatchListener;
import com.shelfsync.converter.service.sync.SyncEngine;
import com.shelfsync.converter.service.sync.SyncJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The single consumer of {@link SyncTaskQueue}. Tasks run one at a time, in enqueue order,
 * to completion; there is no cancellation of an active task.
 */
public class SyncWorker {
    private static final Logger log = LoggerFactory.getLogger(SyncWorker.class);

    public static final String IDLE = "idle";
    public static final String PROCESSING = "processing";

    private final SyncTaskQueue queue;
    private final SyncEngine engine;

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private volatile SyncTask current;
    private volatile SyncDtos.TaskResult lastResult;
    private volatile boolean running;
    private Thread thread;

    public SyncWorker(SyncTaskQueue queue, SyncEngine engine) {
        this.queue = queue;
        this.engine = engine;
    }

    public synchronized void start() {
        if (thread != null) return;
        running = true;
        thread = new Thread(this::loop, "sync-worker");
        thread.setDaemon(true);
        thread.start();
        log.info("Sync worker started");
    }

    public synchronized void stop() {
        running = false;
        if (thread == null) return;
        thread.interrupt();
        try {
            thread.join(TimeUnit.SECONDS.toMillis(30));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        thread = null;
        log.info("Sync worker stopped");
    }

    private void loop() {
        while (running) {
            try {
                SyncTask task = queue.poll(1, TimeUnit.SECONDS);
                if (task != null) execute(task);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.error("Sync worker loop error", e);
            }
        }
    }

    /** Runs the oldest pending task on the calling thread; false when the queue is empty. */
    public boolean processNext() throws InterruptedException {
        SyncTask task = queue.poll(0, TimeUnit.MILLISECONDS);
        if (task == null) return false;
        execute(task);
        return true;
    }

    void execute(SyncTask task) {
        current = task;
        task.markActive();
        SyncDtos.SyncReport report = new SyncDtos.SyncReport();
        try {
            report = engine.run(SyncJob.of(task), BatchListener.NONE, report);
            task.markDone(report);
            processed.incrementAndGet();
            log.info("Sync task {} done: processed={} skipped={} failed={}",
                    task.getId(), report.getProcessed(), report.getSkipped(), report.getFailed());
        } catch (RuntimeException e) {
            report.setFinished_at(Instant.now());
            task.markFailed(e.getMessage() != null ? e.getMessage() : e.toString(), report);
            failed.incrementAndGet();
            log.error("Sync task {} for {} failed", task.getId(), task.getParser_name(), e);
        } finally {
            lastResult = new SyncDtos.TaskResult(task.getId(), task.getParser_name(), task.getState().code(),
                    task.getError(), task.getReport(), task.getFinished_at());
            current = null;
            queue.complete(task);
        }
    }

    public String state() {
        return current != null ? PROCESSING : IDLE;
    }

    public SyncTask currentTask() { return current; }
    public SyncDtos.TaskResult lastResult() { return lastResult; }
    public long processedCount() { return processed.get(); }
    public long failedCount() { return failed.get(); }
    public boolean isRunning() { return running; }
}
