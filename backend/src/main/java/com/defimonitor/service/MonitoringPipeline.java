package com.defimonitor.service;

import com.defimonitor.api.dto.PipelineSummary;
import com.defimonitor.detection.AlertCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ingestion followed by anomaly detection. Detection runs even when some or all ingestions failed,
 * since older snapshots may still reveal an anomaly.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MonitoringPipeline {

    private final SnapshotIngestService ingestService;
    private final DetectionOrchestrator detectionOrchestrator;
    private final Clock clock;

    public PipelineSummary run() {
        Instant start = clock.instant();
        String runId = start.toString();
        log.info("Starting monitoring pipeline run: {}", runId);

        PipelineSummary summary = PipelineSummary.builder()
                .runId(runId)
                .startTime(start.toString())
                .ingestionResults(Map.of())
                .anomalyResults(Map.of())
                .status(PipelineSummary.SUCCESS)
                .build();

        try {
            Map<String, Boolean> ingestion = ingestService.ingestAll();
            summary.setIngestionResults(ingestion);
            if (!ingestion.isEmpty() && !ingestion.containsValue(Boolean.TRUE)) {
                log.error("All protocols failed during ingestion");
                summary.setStatus(PipelineSummary.PARTIAL_FAILURE);
            }

            Map<String, List<AlertCandidate>> anomalies = detectionOrchestrator.detectAll();
            Map<String, Integer> counts = new LinkedHashMap<>();
            anomalies.forEach((protocolId, alerts) -> counts.put(protocolId, alerts.size()));
            summary.setAnomalyResults(counts);
        } catch (Exception e) {
            log.error("Pipeline failed with critical error: {}", e.getMessage(), e);
            summary.setStatus(PipelineSummary.FAILED);
            summary.setError(e.getMessage());
        }

        Instant end = clock.instant();
        summary.setEndTime(end.toString());
        summary.setDurationSeconds(Duration.between(start, end).toMillis() / 1000.0);
        log.info("Pipeline run {} complete: {} in {}s", runId, summary.getStatus(), summary.getDurationSeconds());
        return summary;
    }
}
