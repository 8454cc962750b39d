package com.shelfsync.converter.service.sync;

import com.shelfsync.converter.dto.SyncDtos;

/** Called after each batch has committed and the cursor moved. */
@FunctionalInterface
public interface BatchListener {
    BatchListener NONE = event -> {};

    void onBatch(SyncDtos.BatchEvent event);
}
