package com.shelfsync.converter.service.image;

import java.util.List;

/**
 * Outcome of deduplicating one product's image list. No URL is both kept and removed, and every
 * distinct input URL is in one of them. {@code kept} may hold a stored canonical URL that replaced
 * a superseded input URL. {@code fingerprints} is parallel to {@code kept}.
 */
public record ImageDedupResult(List<String> kept, List<String> removed, List<String> fingerprints) {}
