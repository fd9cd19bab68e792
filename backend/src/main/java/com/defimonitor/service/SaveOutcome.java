package com.defimonitor.service;

public enum SaveOutcome {
    INSERTED,
    DUPLICATE_SUPPRESSED
}
