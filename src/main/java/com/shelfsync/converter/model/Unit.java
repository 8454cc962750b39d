package com.shelfsync.converter.model;

/**
 * Sale unit of a catalog product. {@code PCE} is a discrete item, {@code KGM} and {@code LTR}
 * mark goods sold by bulk weight or volume.
 */
public enum Unit {
    PCE,
    KGM,
    LTR;

    public boolean isBulk() {
        return this != PCE;
    }

    /** Lenient parse of a receiver-declared unit code; unknown codes yield null. */
    public static Unit fromCode(String code) {
        if (code == null) return null;
        String token = code.trim().toUpperCase();
        for (Unit u : values()) {
            if (u.name().equals(token)) return u;
        }
        return null;
    }
}
