package com.shelfsync.converter.model;

/** Canonical unit of a per-item package quantity. */
public enum PackageUnit {
    KGM,
    LTR;

    public static PackageUnit fromCode(String code) {
        if (code == null) return null;
        String token = code.trim().toUpperCase();
        for (PackageUnit u : values()) {
            if (u.name().equals(token)) return u;
        }
        return null;
    }
}
