package com.defimonitor.detection;

import com.defimonitor.model.AlertKind;
import com.defimonitor.model.Severity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Result of a rule that fired. Not persisted until the ledger accepts it.
 */
@Value
@Builder
public class AlertCandidate {
    String protocolId;
    AlertKind kind;
    Severity severity;
    String message;
    Instant triggeredAt;

    public static AlertCandidate of(String protocolId, AlertKind kind, String message, Instant triggeredAt) {
        return AlertCandidate.builder()
                .protocolId(protocolId)
                .kind(kind)
                .severity(kind.getSeverity())
                .message(message)
                .triggeredAt(triggeredAt)
                .build();
    }
}
