package com.sitemonitor.core.model;

public enum PollCycleOutcome {
    /** Fetched payload matched the stored snapshot. */
    NO_CHANGE,
    /** Update detected, subscribers notified, snapshot replaced. */
    CHANGED,
    /** Fetch failed; the stored snapshot is untouched until the next firing. */
    FETCH_FAILED,
    /** Compare or format threw; nothing was sent or persisted. */
    FAILED,
    /** A cycle for the same site was still in flight, so this firing was dropped. */
    SKIPPED
}
