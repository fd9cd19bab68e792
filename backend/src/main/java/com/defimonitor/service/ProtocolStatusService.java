package com.defimonitor.service;

import com.defimonitor.api.dto.ProtocolStatusDTO;
import com.defimonitor.api.dto.SnapshotPointDTO;
import com.defimonitor.config.AppProps;
import com.defimonitor.model.ProtocolAlert;
import com.defimonitor.model.ProtocolSnapshot;
import com.defimonitor.model.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read model for the reporting API: latest metrics plus a health status per protocol.
 * Status is the worst severity among open alerts triggered in the last 24 hours.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProtocolStatusService {

    private static final Duration STATUS_WINDOW = Duration.ofHours(24);

    private final SnapshotStore snapshotStore;
    private final AlertLedger alertLedger;
    private final AppProps props;
    private final Clock clock;

    public List<ProtocolStatusDTO> currentStatus() {
        List<ProtocolStatusDTO> out = new ArrayList<>();
        for (String protocolId : props.getProtocols().keySet()) {
            out.add(statusOf(protocolId));
        }
        return out;
    }

    /**
     * Snapshots of the last {@code days} days, newest first. The range of {@code days} is enforced by the API.
     *
     * @throws com.defimonitor.exception.ConfigurationException for an unknown protocol
     */
    public List<SnapshotPointDTO> history(String protocolId, int days) {
        props.require(protocolId);
        Instant since = clock.instant().minus(Duration.ofDays(days));
        return snapshotStore.history(protocolId, since).stream()
                .map(SnapshotPointDTO::from)
                .toList();
    }

    private ProtocolStatusDTO statusOf(String protocolId) {
        Optional<ProtocolSnapshot> latest;
        try {
            latest = snapshotStore.latest(protocolId);
        } catch (RuntimeException e) {
            log.error("Error reading latest snapshot of {}: {}", protocolId, e.getMessage());
            latest = Optional.empty();
        }
        if (latest.isEmpty()) {
            return ProtocolStatusDTO.builder()
                    .name(protocolId)
                    .status(ProtocolStatusDTO.UNKNOWN)
                    .build();
        }
        ProtocolSnapshot s = latest.get();
        return ProtocolStatusDTO.builder()
                .name(protocolId)
                .tvl(s.getTvlUsd())
                .apy(s.getApy7d())
                .utilization(s.getUtilizationRate())
                .status(healthOf(protocolId))
                .lastUpdated(s.getTs() == null ? null : s.getTs().toString())
                .build();
    }

    private String healthOf(String protocolId) {
        try {
            return alertLedger.openSince(protocolId, clock.instant().minus(STATUS_WINDOW)).stream()
                    .map(ProtocolAlert::getSeverity)
                    .filter(sev -> sev != Severity.INFO)
                    .min(Comparator.comparingInt(Severity::getRank))
                    .map(Severity::getCode)
                    .orElse(ProtocolStatusDTO.HEALTHY);
        } catch (RuntimeException e) {
            log.error("Error determining status for {}: {}", protocolId, e.getMessage());
            return ProtocolStatusDTO.UNKNOWN;
        }
    }
}
