package com.defimonitor.service;

import com.defimonitor.config.AppProps;
import com.defimonitor.detection.AlertCandidate;
import com.defimonitor.detection.AnomalyRule;
import com.defimonitor.model.ProtocolSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs every anomaly rule for the configured protocols and hands what fires to the ledger.
 * A failure while checking one protocol never stops the others.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DetectionOrchestrator {

    private final List<AnomalyRule> rules;
    private final SnapshotStore snapshotStore;
    private final AlertLedger alertLedger;
    private final AppProps props;
    private final Clock clock;

    /**
     * Evaluates all rules for one protocol against a single read of its latest snapshot,
     * saving each candidate as soon as it is produced.
     *
     * @return every candidate detected in this run, including those the ledger suppressed as duplicates
     * @throws com.defimonitor.exception.ConfigurationException when the protocol is not configured
     */
    public List<AlertCandidate> detectOne(String protocolId) {
        AppProps.Protocol protocol = props.require(protocolId);
        Instant now = clock.instant();

        Optional<ProtocolSnapshot> latest = snapshotStore.latest(protocolId);
        if (latest.isEmpty()) {
            log.info("No snapshots stored for {}, skipping detection", protocolId);
            return List.of();
        }

        List<AlertCandidate> detected = new ArrayList<>();
        for (AnomalyRule rule : rules) {
            rule.evaluate(snapshotStore, latest.get(), protocol, now).ifPresent(candidate -> {
                detected.add(candidate);
                SaveOutcome outcome = alertLedger.save(candidate);
                log.debug("[detection] {} {} -> {}", protocolId, candidate.getKind().getCode(), outcome);
            });
        }
        return detected;
    }

    /**
     * @return candidates per configured protocol, in configuration order; a protocol whose
     * check failed maps to an empty list
     */
    public Map<String, List<AlertCandidate>> detectAll() {
        Map<String, List<AlertCandidate>> all = new LinkedHashMap<>();
        props.getProtocols().keySet().forEach(protocolId -> {
            try {
                log.info("Checking anomalies for {}", protocolId);
                List<AlertCandidate> alerts = detectOne(protocolId);
                all.put(protocolId, alerts);
                if (alerts.isEmpty()) {
                    log.info("No anomalies detected for {}", protocolId);
                } else {
                    log.warn("Detected {} anomalies for {}", alerts.size(), protocolId);
                }
            } catch (Exception e) {
                log.error("Error detecting anomalies for {}: {}", protocolId, e.getMessage(), e);
                all.put(protocolId, List.of());
            }
        });

        int total = all.values().stream().mapToInt(List::size).sum();
        log.info("Anomaly detection complete: {} total alerts", total);
        return all;
    }
}
