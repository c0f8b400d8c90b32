package com.sitemonitor.service.runtime;

public class AdapterLoadException extends RuntimeException {
    private final String siteId;

    public AdapterLoadException(String siteId, String message) {
        super(message);
        this.siteId = siteId;
    }

    public String siteId() {
        return siteId;
    }
}
