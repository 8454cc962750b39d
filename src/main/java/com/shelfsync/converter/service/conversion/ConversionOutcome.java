package com.shelfsync.converter.service.conversion;

import com.shelfsync.converter.model.NormalizedProduct;

/** Per-record result of the conversion pipeline: a product, or a typed failure. */
public record ConversionOutcome(NormalizedProduct product, FailureType failureType, String message) {

    public enum FailureType {
        UNKNOWN_PARSER,
        IMAGE_DELETE,
        CONVERSION_ERROR
    }

    public static ConversionOutcome success(NormalizedProduct product) {
        return new ConversionOutcome(product, null, null);
    }

    public static ConversionOutcome failure(FailureType type, String message) {
        return new ConversionOutcome(null, type, message);
    }

    public boolean isSuccess() {
        return failureType == null;
    }

    public String describeFailure() {
        return failureType + ": " + message;
    }
}
