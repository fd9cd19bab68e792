package com.defimonitor.detection;

import com.defimonitor.config.AppProps;
import com.defimonitor.model.AlertKind;
import com.defimonitor.model.ProtocolSnapshot;
import com.defimonitor.service.SnapshotStore;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/** Warning when the latest 7-day APY is strictly below {@code apyMinPercent}. */
@Component
@Order(2)
@RequiredArgsConstructor
public class ApyLowRule implements AnomalyRule {

    private final AppProps props;

    @Override
    public AlertKind kind() {
        return AlertKind.APY_LOW;
    }

    @Override
    public Optional<AlertCandidate> evaluate(SnapshotStore store, ProtocolSnapshot latest, AppProps.Protocol protocol, Instant now) {
        BigDecimal apy = latest.getApy7d();
        if (apy == null) {
            return Optional.empty();
        }

        double threshold = props.getThresholds().getApyMinPercent();
        if (apy.compareTo(BigDecimal.valueOf(threshold)) >= 0) {
            return Optional.empty();
        }

        String message = String.format(Locale.US,
                "APY dropped below threshold: %.2f%% (threshold: %.2f%%)", apy, threshold);
        return Optional.of(AlertCandidate.of(latest.getProtocolId(), kind(), message, now));
    }
}
