package com.sitemonitor.core.model;

public enum RecipientKind {
    GROUP,
    INDIVIDUAL
}
