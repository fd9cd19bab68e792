package com.defimonitor.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Kind of anomaly an alert reports. Each kind always fires with the same severity.
 */
@Getter
@RequiredArgsConstructor
public enum AlertKind {
    TVL_DROP("tvl_drop", Severity.CRITICAL),
    APY_LOW("apy_low", Severity.WARNING),
    UTILIZATION_HIGH("utilization_high", Severity.WARNING);

    private final String code;
    private final Severity severity;
}
