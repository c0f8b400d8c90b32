package com.sitemonitor.service.command;

public record SiteSummary(String displayName, String description) {
}
