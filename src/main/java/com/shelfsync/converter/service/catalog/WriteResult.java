package com.shelfsync.converter.service.catalog;

/**
 * @param snapshotId the snapshot now current for the product
 * @param appended   false when the record matched the latest snapshot and no row was added
 */
public record WriteResult(long snapshotId, boolean appended) {}
