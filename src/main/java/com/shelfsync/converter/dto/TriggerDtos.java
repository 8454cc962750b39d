package com.shelfsync.converter.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.shelfsync.converter.model.SyncTask;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public class TriggerDtos {

    /** Body of {@code POST /trigger}; every field is optional and falls back to the server configuration. */
    public static class TriggerRequest {
        @Size(max = 64)
        private String parser_name;
        private String run_id;
        private String source; // "receiver" when absent
        @JsonAlias("receiver_db")
        private String receiver_location;
        @JsonAlias("catalog_db")
        private String catalog_location;
        @Positive
        private Integer batch_size;
        @PositiveOrZero
        private Integer max_batches;

        public String getParser_name() { return parser_name; }
        public void setParser_name(String parser_name) { this.parser_name = parser_name; }
        public String getRun_id() { return run_id; }
        public void setRun_id(String run_id) { this.run_id = run_id; }
        public String getSource() { return source; }
        public void setSource(String source) { this.source = source; }
        public String getReceiver_location() { return receiver_location; }
        public void setReceiver_location(String receiver_location) { this.receiver_location = receiver_location; }
        public String getCatalog_location() { return catalog_location; }
        public void setCatalog_location(String catalog_location) { this.catalog_location = catalog_location; }
        public Integer getBatch_size() { return batch_size; }
        public void setBatch_size(Integer batch_size) { this.batch_size = batch_size; }
        public Integer getMax_batches() { return max_batches; }
        public void setMax_batches(Integer max_batches) { this.max_batches = max_batches; }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class TriggerResponse {
        private String status; // accepted | duplicate | queue_full
        private String task_id;
        private Integer queue_depth;
        private String error;
        private SyncTask task;

        public TriggerResponse() {}

        public TriggerResponse(String status) {
            this.status = status;
        }

        public String getStatus() { return status; }
        public void setStatus(String status) { this.status = status; }
        public String getTask_id() { return task_id; }
        public void setTask_id(String task_id) { this.task_id = task_id; }
        public Integer getQueue_depth() { return queue_depth; }
        public void setQueue_depth(Integer queue_depth) { this.queue_depth = queue_depth; }
        public String getError() { return error; }
        public void setError(String error) { this.error = error; }
        public SyncTask getTask() { return task; }
        public void setTask(SyncTask task) { this.task = task; }
    }

    public static class HealthResponse {
        private String worker_state; // idle | processing
        private boolean worker_running;
        private int queue_depth;
        private int queue_capacity;
        private String active_task_id;
        private long total_enqueued;
        private long total_duplicates;
        private long total_rejected;
        private long total_processed;
        private long total_failed;
        private SyncDtos.TaskResult last_result;

        public String getWorker_state() { return worker_state; }
        public void setWorker_state(String worker_state) { this.worker_state = worker_state; }
        public boolean isWorker_running() { return worker_running; }
        public void setWorker_running(boolean worker_running) { this.worker_running = worker_running; }
        public int getQueue_depth() { return queue_depth; }
        public void setQueue_depth(int queue_depth) { this.queue_depth = queue_depth; }
        public int getQueue_capacity() { return queue_capacity; }
        public void setQueue_capacity(int queue_capacity) { this.queue_capacity = queue_capacity; }
        public String getActive_task_id() { return active_task_id; }
        public void setActive_task_id(String active_task_id) { this.active_task_id = active_task_id; }
        public long getTotal_enqueued() { return total_enqueued; }
        public void setTotal_enqueued(long total_enqueued) { this.total_enqueued = total_enqueued; }
        public long getTotal_duplicates() { return total_duplicates; }
        public void setTotal_duplicates(long total_duplicates) { this.total_duplicates = total_duplicates; }
        public long getTotal_rejected() { return total_rejected; }
        public void setTotal_rejected(long total_rejected) { this.total_rejected = total_rejected; }
        public long getTotal_processed() { return total_processed; }
        public void setTotal_processed(long total_processed) { this.total_processed = total_processed; }
        public long getTotal_failed() { return total_failed; }
        public void setTotal_failed(long total_failed) { this.total_failed = total_failed; }
        public SyncDtos.TaskResult getLast_result() { return last_result; }
        public void setLast_result(SyncDtos.TaskResult last_result) { this.last_result = last_result; }
    }
}
