package com.defimonitor.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.IndexDirection;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Persisted alert. Open while {@code resolvedAt} is null; only resolution ever changes it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document("protocol_alerts")
@CompoundIndexes({
        @CompoundIndex(name = "by_protocol_kind_open", def = "{'protocolId':1,'kind':1,'resolvedAt':1,'triggeredAt':-1}")
})
public class ProtocolAlert {

    @Id
    private String id;

    private String protocolId;

    private AlertKind kind;

    private Severity severity;

    private String message;

    @Indexed(direction = IndexDirection.DESCENDING)
    private Instant triggeredAt;

    private Instant resolvedAt;

    public boolean isOpen() {
        return resolvedAt == null;
    }
}
