package com.sitemonitor.service.notify;

public enum DeliveryOutcome {
    GROUP,
    INDIVIDUAL,
    FAILED
}
