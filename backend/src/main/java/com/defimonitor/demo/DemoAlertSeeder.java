package com.defimonitor.demo;

import com.defimonitor.detection.AlertCandidate;
import com.defimonitor.model.ProtocolSnapshot;
import com.defimonitor.notify.SlackWebhookSink;
import com.defimonitor.service.DetectionOrchestrator;
import com.defimonitor.service.SnapshotStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Seeds one protocol with a 24h-old healthy sample and a current degraded one, so every
 * rule fires, then runs detection and pings Slack. Only active with the "demo" profile.
 */
@Component
@Profile("demo")
@RequiredArgsConstructor
@Slf4j
public class DemoAlertSeeder implements CommandLineRunner {

    private final SnapshotStore snapshotStore;
    private final DetectionOrchestrator detectionOrchestrator;
    private final SlackWebhookSink slackWebhookSink;
    private final Clock clock;

    @Value("${app.demo.protocol:aave-v3}")
    private String protocolId;

    @Override
    public void run(String... args) {
        Instant now = clock.instant();

        snapshotStore.append(ProtocolSnapshot.builder()
                .protocolId(protocolId)
                .ts(now.minus(Duration.ofHours(24)))
                .tvlUsd(new BigDecimal("50000000000.00"))
                .apy7d(new BigDecimal("5.00"))
                .utilizationRate(new BigDecimal("0.75"))
                .build());
        snapshotStore.overwriteTvl(ProtocolSnapshot.builder()
                .protocolId(protocolId)
                .ts(now)
                .tvlUsd(new BigDecimal("35000000000.00"))
                .apy7d(new BigDecimal("1.50"))
                .utilizationRate(new BigDecimal("0.97"))
                .build());
        log.info("[demo] seeded {}: $50B -> $35B TVL, 1.5% APY, 97% utilization", protocolId);

        List<AlertCandidate> detected = detectionOrchestrator.detectOne(protocolId);
        detected.forEach(c -> log.info("[demo] {}: {}", c.getSeverity().getCode(), c.getMessage()));

        if (slackWebhookSink.sendTestMessage()) {
            log.info("[demo] Slack test message sent");
        }
    }
}
