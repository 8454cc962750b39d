package com.shelfsync.converter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Image storage service used to delete duplicate images. Storage deletes are disabled
 * unless both {@code base-url} and {@code api-token} are set.
 */
@ConfigurationProperties(prefix = "storage")
public class StorageProperties {
    private String baseUrl;
    private String apiToken;
    /** Seconds before a delete call is abandoned and counted as failed. */
    private double deleteTimeout = 10;
    /** Abort the record on a failed delete instead of logging and continuing. */
    private boolean strict;

    public boolean isConfigured() {
        return baseUrl != null && !baseUrl.isBlank() && apiToken != null && !apiToken.isBlank();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiToken() {
        return apiToken;
    }

    public void setApiToken(String apiToken) {
        this.apiToken = apiToken;
    }

    public double getDeleteTimeout() {
        return deleteTimeout;
    }

    public void setDeleteTimeout(double deleteTimeout) {
        this.deleteTimeout = deleteTimeout;
    }

    public boolean isStrict() {
        return strict;
    }

    public void setStrict(boolean strict) {
        this.strict = strict;
    }
}
