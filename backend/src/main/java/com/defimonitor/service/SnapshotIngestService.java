package com.defimonitor.service;

import com.defimonitor.client.DefiLlamaClient;
import com.defimonitor.config.AppProps;
import com.defimonitor.model.ProtocolSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Samples each configured protocol once and appends the snapshot.
 * TVL comes from DefiLlama; APY and utilization are taken from configuration until on-chain reads exist.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotIngestService {

    private final DefiLlamaClient defiLlamaClient;
    private final SnapshotStore snapshotStore;
    private final AppProps props;
    private final Clock clock;

    /**
     * @return true when a new snapshot was stored; false when TVL was unavailable or the sample already existed
     */
    public boolean ingest(String protocolId) {
        AppProps.Protocol protocol = props.require(protocolId);
        log.info("Fetching data for {}", protocol.getName());

        Optional<BigDecimal> tvl = defiLlamaClient.fetchTvl(protocol.getDefillamaSlug());
        if (tvl.isEmpty()) {
            log.warn("Failed to fetch data for {}", protocolId);
            return false;
        }

        ProtocolSnapshot row = ProtocolSnapshot.builder()
                .protocolId(protocolId)
                .ts(Instant.now(clock))
                .tvlUsd(tvl.get())
                .apy7d(protocol.getApy7d())
                .utilizationRate(protocol.isLending() ? protocol.getUtilizationRate() : null)
                .build();

        boolean stored = snapshotStore.append(row);
        if (!stored) {
            log.warn("Data already exists for {} at {} (idempotent)", protocolId, row.getTs());
        }
        return stored;
    }

    /** Ingests every configured protocol; one failure never stops the rest. */
    public Map<String, Boolean> ingestAll() {
        Map<String, Boolean> results = new LinkedHashMap<>();
        props.getProtocols().keySet().forEach(protocolId -> {
            try {
                boolean ok = ingest(protocolId);
                results.put(protocolId, ok);
                if (ok) log.info("Successfully ingested {}", protocolId);
            } catch (Exception e) {
                log.error("Error processing {}: {}", protocolId, e.getMessage(), e);
                results.put(protocolId, false);
            }
        });
        long ok = results.values().stream().filter(Boolean::booleanValue).count();
        log.info("Ingestion complete: {}/{} protocols successful", ok, results.size());
        return results;
    }
}
