package com.shelfsync.converter.service.image;

import java.util.Optional;

/** Delete side of the external image storage service. */
public interface ImageStorageGateway {

    /** True only for URLs under the configured storage origin with a deletable asset path. */
    boolean isManaged(String url);

    /**
     * Storage asset a managed URL points at. URLs that differ only in query or fragment share
     * an asset, so a delete for one removes the other.
     */
    default Optional<String> assetName(String url) {
        return isManaged(url) ? Optional.of(url) : Optional.empty();
    }

    /**
     * Deletes the asset behind a managed URL. A missing asset counts as deleted.
     *
     * @throws ImageDeleteException on any other failure, including a timeout
     */
    void delete(String url);

    /** Gateway used when storage is not configured: nothing is managed, nothing is deleted. */
    ImageStorageGateway DISABLED = new ImageStorageGateway() {
        @Override
        public boolean isManaged(String url) {
            return false;
        }

        @Override
        public void delete(String url) {
            throw new IllegalStateException("Image storage is not configured");
        }
    };
}
