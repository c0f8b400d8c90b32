package com.sitemonitor.sites.web;

/**
 * Which part of a fetched page decides whether it changed.
 */
public enum ParseMode {
    RAW_HASH,
    TEXT,
    TITLE,
    LINKS
}
