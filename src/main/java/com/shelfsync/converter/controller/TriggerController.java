package com.shelfsync.converter.controller;

import com.shelfsync.converter.config.ConverterProperties;
import com.shelfsync.converter.dto.TriggerDtos;
import com.shelfsync.converter.model.SyncTask;
import com.shelfsync.converter.service.queue.EnqueueResult;
import com.shelfsync.converter.service.queue.QueueFullException;
import com.shelfsync.converter.service.queue.SyncTaskQueue;
import com.shelfsync.converter.service.queue.SyncTaskRegistry;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Accepts sync requests into the task queue. The HTTP side only enqueues; the sync itself runs
 * on the worker thread.
 */
@RestController
public class TriggerController {
    private static final Logger log = LoggerFactory.getLogger(TriggerController.class);

    static final String DEFAULT_PARSER = "fixprice";
    static final String DEFAULT_SOURCE = "receiver";

    private final SyncTaskQueue queue;
    private final SyncTaskRegistry tasks;
    private final ConverterProperties properties;

    public TriggerController(SyncTaskQueue queue, SyncTaskRegistry tasks, ConverterProperties properties) {
        this.queue = queue;
        this.tasks = tasks;
        this.properties = properties;
    }

    @PostMapping(value = {"/trigger", "/enqueue"}, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<TriggerDtos.TriggerResponse>> trigger(
            @Valid @RequestBody(required = false) TriggerDtos.TriggerRequest body) {
        TriggerDtos.TriggerRequest req = body != null ? body : new TriggerDtos.TriggerRequest();

        String receiver = firstNonBlank(req.getReceiver_location(), properties.getReceiverLocation());
        String catalog = firstNonBlank(req.getCatalog_location(), properties.getCatalogLocation());
        if (receiver == null) return badRequest("receiver_location is required");
        if (catalog == null) return badRequest("catalog_location is required");

        String parser = firstNonBlank(req.getParser_name(), firstNonBlank(properties.getParserName(), DEFAULT_PARSER));
        int batchSize = req.getBatch_size() != null ? req.getBatch_size() : properties.getBatchSize();
        int maxBatches = req.getMax_batches() != null ? req.getMax_batches() : properties.getMaxBatches();
        SyncTask task = new SyncTask(receiver, catalog, parser, batchSize, maxBatches,
                firstNonBlank(req.getRun_id(), null), firstNonBlank(req.getSource(), DEFAULT_SOURCE));

        TriggerDtos.TriggerResponse response;
        try {
            EnqueueResult result = queue.enqueue(task);
            if (result.isAccepted()) {
                tasks.put(task);
                response = respond("accepted", result.task());
                response.setTask(task);
                return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).body(response));
            }
            response = respond("duplicate", result.task());
            return Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).body(response));
        } catch (QueueFullException e) {
            log.warn("Rejected sync request for {}: {}", parser, e.getMessage());
            response = respond("queue_full", null);
            response.setError(e.getMessage());
            return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response));
        }
    }

    @GetMapping(value = "/tasks/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<SyncTask>> task(@PathVariable("id") String id) {
        return Mono.just(tasks.get(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build()));
    }

    private TriggerDtos.TriggerResponse respond(String status, SyncTask task) {
        TriggerDtos.TriggerResponse response = new TriggerDtos.TriggerResponse(status);
        response.setQueue_depth(queue.depth());
        if (task != null) response.setTask_id(task.getId());
        return response;
    }

    private static Mono<ResponseEntity<TriggerDtos.TriggerResponse>> badRequest(String error) {
        TriggerDtos.TriggerResponse response = new TriggerDtos.TriggerResponse("rejected");
        response.setError(error);
        return Mono.just(ResponseEntity.badRequest().body(response));
    }

    private static String firstNonBlank(String value, String fallback) {
        if (value != null && !value.isBlank()) return value.trim();
        return fallback;
    }
}
