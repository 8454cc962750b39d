package com.shelfsync.converter.service.queue;

import com.shelfsync.converter.model.SyncTask;

/**
 * @param task the queued task; for {@link Status#DUPLICATE} the pending or active task that
 *             already holds the key
 */
public record EnqueueResult(Status status, SyncTask task) {

    public enum Status { ACCEPTED, DUPLICATE }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }
}
