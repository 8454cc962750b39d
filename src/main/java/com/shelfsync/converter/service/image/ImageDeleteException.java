package com.shelfsync.converter.service.image;

public class ImageDeleteException extends RuntimeException {
    private final String url;

    public ImageDeleteException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
