package com.defimonitor.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum Severity {
    CRITICAL("critical", "#FF0000", "🚨", 1),
    WARNING("warning", "#FFA500", "⚠️", 2),
    INFO("info", "#0000FF", "ℹ️", 3);

    private final String code;
    /** Slack attachment colour. */
    private final String color;
    private final String emoji;
    /** Lower is worse. */
    private final int rank;
}
