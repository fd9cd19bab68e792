package com.defimonitor.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One sample of a protocol's metrics at a point in time.
 * (protocolId, ts) is the natural key; a snapshot is never changed once written.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("protocol_snapshots")
@CompoundIndexes({
        // one snapshot per protocol per exact timestamp; also serves latest/as-of lookups
        @CompoundIndex(name = "uniq_protocol_ts", def = "{'protocolId':1,'ts':-1}", unique = true)
})
public class ProtocolSnapshot {

    @Id
    private String id;

    /** Configured protocol key, e.g. "aave-v3". */
    private String protocolId;

    /** UTC timestamp of when the sample was taken. */
    private Instant ts;

    /** Total value locked in USD; null means unknown, not zero. */
    private BigDecimal tvlUsd;

    /** 7-day APY in percent. */
    private BigDecimal apy7d;

    /** Borrowed / supplied as a fraction in [0,1]; lending protocols only. */
    private BigDecimal utilizationRate;
}
