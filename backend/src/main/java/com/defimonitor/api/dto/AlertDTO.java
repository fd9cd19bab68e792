package com.defimonitor.api.dto;

import com.defimonitor.model.ProtocolAlert;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Wire form of an alert; instants are ISO-8601 UTC strings.
 */
@Data
@Builder
public class AlertDTO {

    private String id;
    @JsonProperty("protocol_id")
    private String protocolId;
    @JsonProperty("alert_kind")
    private String alertKind;
    private String severity;
    private String message;
    @JsonProperty("triggered_at")
    private String triggeredAt;
    @JsonProperty("resolved_at")
    private String resolvedAt;
    /** "open" or "resolved" */
    private String status;

    public static AlertDTO from(ProtocolAlert a) {
        return AlertDTO.builder()
                .id(a.getId())
                .protocolId(a.getProtocolId())
                .alertKind(a.getKind().getCode())
                .severity(a.getSeverity().getCode())
                .message(a.getMessage())
                .triggeredAt(iso(a.getTriggeredAt()))
                .resolvedAt(iso(a.getResolvedAt()))
                .status(a.isOpen() ? "open" : "resolved")
                .build();
    }

    private static String iso(Instant t) {
        return t == null ? null : t.toString();
    }
}
