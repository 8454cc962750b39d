package com.shelfsync.converter.service.identity;

import com.shelfsync.converter.util.HashUtils;

import java.util.Locale;

/** One natural key of a product: {@code plu}, {@code sku}, {@code source_id} or {@code normalized_name}. */
public record IdentityKey(String type, String value) {
    public static final String PLU = "plu";
    public static final String SKU = "sku";
    public static final String SOURCE_ID = "source_id";
    public static final String NORMALIZED_NAME = "normalized_name";

    static final int MAX_VALUE_LENGTH = 255;

    /** Returns null for a blank value; long values are stored as their hash. */
    public static IdentityKey of(String type, String value) {
        if (value == null || value.isBlank()) return null;
        String token = value.trim();
        if (NORMALIZED_NAME.equals(type)) token = token.toLowerCase(Locale.ROOT);
        if (token.length() > MAX_VALUE_LENGTH) token = "sha256:" + HashUtils.sha256Hex(token);
        return new IdentityKey(type, token);
    }
}
