package com.shelfsync.converter.service.sync;

import com.shelfsync.converter.model.SyncTask;

import java.util.Locale;

/**
 * Parameters of one sync run.
 *
 * @param maxBatches 0 means no limit
 */
public record SyncJob(
        String receiverLocation,
        String catalogLocation,
        String parserName,
        int batchSize,
        int maxBatches,
        String runId,
        String source
) {
    public SyncJob {
        if (receiverLocation == null || receiverLocation.isBlank()) {
            throw new IllegalArgumentException("receiver location is required");
        }
        if (catalogLocation == null || catalogLocation.isBlank()) {
            throw new IllegalArgumentException("catalog location is required");
        }
        if (parserName == null || parserName.isBlank()) {
            throw new IllegalArgumentException("parser name is required");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batch size must be >= 1");
        }
        if (maxBatches < 0) {
            throw new IllegalArgumentException("max batches must be >= 0");
        }
        receiverLocation = receiverLocation.trim();
        catalogLocation = catalogLocation.trim();
        parserName = parserName.trim().toLowerCase(Locale.ROOT);
    }

    public static SyncJob of(SyncTask task) {
        return new SyncJob(task.getReceiver_location(), task.getCatalog_location(), task.getParser_name(),
                task.getBatch_size(), task.getMax_batches(), task.getRun_id(), task.getSource());
    }
}
