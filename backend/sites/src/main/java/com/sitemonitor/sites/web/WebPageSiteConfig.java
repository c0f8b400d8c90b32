package com.sitemonitor.sites.web;

public record WebPageSiteConfig(
        String id,
        String displayName,
        String description,
        String url,
        String schedule,
        ParseMode parseMode
) {
    public ParseMode parseModeOrDefault() {
        return parseMode == null ? ParseMode.TEXT : parseMode;
    }
}
