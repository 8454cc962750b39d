package com.shelfsync.converter.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.shelfsync.converter.dto.SyncDtos;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * One queued sync request. Created by the trigger endpoint, moved through
 * {@code pending -> active -> done|failed} by the task queue and worker.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncTask {

    /** Tasks with equal keys never coexist in pending or active state. */
    public record Key(String receiverLocation, String catalogLocation, String parserName) {}

    private final String id;
    private final String receiver_location;
    private final String catalog_location;
    private final String parser_name;
    private final int batch_size;
    private final int max_batches;
    private final String run_id;
    private final String source;
    private final Instant enqueued_at;

    private volatile TaskState state = TaskState.PENDING;
    private volatile Instant started_at;
    private volatile Instant finished_at;
    private volatile SyncDtos.SyncReport report;
    private volatile String error;

    public SyncTask(String receiverLocation, String catalogLocation, String parserName,
                    int batchSize, int maxBatches, String runId, String source) {
        this.id = UUID.randomUUID().toString();
        this.receiver_location = receiverLocation.trim();
        this.catalog_location = catalogLocation.trim();
        this.parser_name = parserName.trim().toLowerCase(Locale.ROOT);
        this.batch_size = Math.max(1, batchSize);
        this.max_batches = Math.max(0, maxBatches);
        this.run_id = runId;
        this.source = source;
        this.enqueued_at = Instant.now();
    }

    @JsonIgnore
    public Key key() {
        return new Key(receiver_location, catalog_location, parser_name);
    }

    public void markActive() {
        state = TaskState.ACTIVE;
        started_at = Instant.now();
    }

    public void markDone(SyncDtos.SyncReport report) {
        this.report = report;
        this.finished_at = Instant.now();
        this.state = TaskState.DONE;
    }

    public void markFailed(String error, SyncDtos.SyncReport partial) {
        this.error = error;
        this.report = partial;
        this.finished_at = Instant.now();
        this.state = TaskState.FAILED;
    }

    public String getId() { return id; }
    public String getReceiver_location() { return receiver_location; }
    public String getCatalog_location() { return catalog_location; }
    public String getParser_name() { return parser_name; }
    public int getBatch_size() { return batch_size; }
    public int getMax_batches() { return max_batches; }
    public String getRun_id() { return run_id; }
    public String getSource() { return source; }
    public Instant getEnqueued_at() { return enqueued_at; }
    public TaskState getState() { return state; }
    public Instant getStarted_at() { return started_at; }
    public Instant getFinished_at() { return finished_at; }
    public SyncDtos.SyncReport getReport() { return report; }
    public String getError() { return error; }
}
