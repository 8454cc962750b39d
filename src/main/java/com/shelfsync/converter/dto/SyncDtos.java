package com.shelfsync.converter.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class SyncDtos {

    /** Outcome of one sync run: per-record counters plus the cursor it stopped at. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SyncReport {
        static final int MAX_FAILURE_DETAILS = 50;

        private String parser_name;
        private int processed; // written with a new snapshot
        private int skipped; // unchanged since the latest snapshot, no new snapshot row
        private int failed; // conversion or write failed, rolled back
        private int batches;
        private String cursor_ingested_at;
        private Long cursor_product_id;
        private Instant started_at;
        private Instant finished_at;
        private List<String> failures = new ArrayList<>(); // first failures, "source_id: message"

        public void recordProcessed() { processed++; }
        public void recordSkipped() { skipped++; }

        public void recordFailure(String sourceId, String message) {
            failed++;
            if (failures.size() < MAX_FAILURE_DETAILS) {
                failures.add(sourceId + ": " + message);
            }
        }

        public int total() { return processed + skipped + failed; }

        public String getParser_name() { return parser_name; }
        public void setParser_name(String parser_name) { this.parser_name = parser_name; }
        public int getProcessed() { return processed; }
        public void setProcessed(int processed) { this.processed = processed; }
        public int getSkipped() { return skipped; }
        public void setSkipped(int skipped) { this.skipped = skipped; }
        public int getFailed() { return failed; }
        public void setFailed(int failed) { this.failed = failed; }
        public int getBatches() { return batches; }
        public void setBatches(int batches) { this.batches = batches; }
        public String getCursor_ingested_at() { return cursor_ingested_at; }
        public void setCursor_ingested_at(String cursor_ingested_at) { this.cursor_ingested_at = cursor_ingested_at; }
        public Long getCursor_product_id() { return cursor_product_id; }
        public void setCursor_product_id(Long cursor_product_id) { this.cursor_product_id = cursor_product_id; }
        public Instant getStarted_at() { return started_at; }
        public void setStarted_at(Instant started_at) { this.started_at = started_at; }
        public Instant getFinished_at() { return finished_at; }
        public void setFinished_at(Instant finished_at) { this.finished_at = finished_at; }
        public List<String> getFailures() { return failures; }
        public void setFailures(List<String> failures) { this.failures = failures; }
    }

    /** Progress callback payload, emitted after each committed batch. */
    public record BatchEvent(int batchNumber, int batchSize, int totalSeen, String cursorIngestedAt, long cursorProductId) {}

    /** Terminal outcome of a queued task, reported as {@code last_result} by the health endpoint. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class TaskResult {
        private String task_id;
        private String parser_name;
        private String status; // done | failed
        private String error;
        private SyncReport report;
        private Instant finished_at;

        public TaskResult() {}

        public TaskResult(String task_id, String parser_name, String status, String error, SyncReport report, Instant finished_at) {
            this.task_id = task_id;
            this.parser_name = parser_name;
            this.status = status;
            this.error = error;
            this.report = report;
            this.finished_at = finished_at;
        }

        public String getTask_id() { return task_id; }
        public void setTask_id(String task_id) { this.task_id = task_id; }
        public String getParser_name() { return parser_name; }
        public void setParser_name(String parser_name) { this.parser_name = parser_name; }
        public String getStatus() { return status; }
        public void setStatus(String status) { this.status = status; }
        public String getError() { return error; }
        public void setError(String error) { this.error = error; }
        public SyncReport getReport() { return report; }
        public void setReport(SyncReport report) { this.report = report; }
        public Instant getFinished_at() { return finished_at; }
        public void setFinished_at(Instant finished_at) { this.finished_at = finished_at; }
    }
}
