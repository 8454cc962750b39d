package com.shelfsync.converter.service.image;

/** Maps an image URL to a content fingerprint; equal fingerprints mean equivalent images. */
public interface ImageFingerprinter {
    String fingerprint(String imageUrl);
}
