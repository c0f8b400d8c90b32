package com.sitemonitor.sites.api;

public class FetchException extends RuntimeException {
    private final String siteId;

    public FetchException(String siteId, String message) {
        super(message);
        this.siteId = siteId;
    }

    public FetchException(String siteId, String message, Throwable cause) {
        super(message, cause);
        this.siteId = siteId;
    }

    public String siteId() {
        return siteId;
    }
}
