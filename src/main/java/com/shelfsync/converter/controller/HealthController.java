package com.shelfsync.converter.controller;

import com.shelfsync.converter.dto.TriggerDtos;
import com.shelfsync.converter.model.SyncTask;
import com.shelfsync.converter.service.queue.SyncTaskQueue;
import com.shelfsync.converter.service.queue.SyncWorker;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
public class HealthController {
    private final SyncTaskQueue queue;
    private final SyncWorker worker;

    public HealthController(SyncTaskQueue queue, SyncWorker worker) {
        this.queue = queue;
        this.worker = worker;
    }

    @GetMapping(value = {"/health", "/queue"}, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<TriggerDtos.HealthResponse>> health() {
        TriggerDtos.HealthResponse body = new TriggerDtos.HealthResponse();
        SyncTask active = worker.currentTask();
        body.setWorker_state(worker.state());
        body.setWorker_running(worker.isRunning());
        body.setActive_task_id(active != null ? active.getId() : null);
        body.setQueue_depth(queue.depth());
        body.setQueue_capacity(queue.capacity());
        body.setTotal_enqueued(queue.enqueuedCount());
        body.setTotal_duplicates(queue.duplicateCount());
        body.setTotal_rejected(queue.rejectedCount());
        body.setTotal_processed(worker.processedCount());
        body.setTotal_failed(worker.failedCount());
        body.setLast_result(worker.lastResult());
        return Mono.just(ResponseEntity.ok(body));
    }
}
