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

/**
 * Warning when a lending protocol's utilization, in percent, exceeds {@code utilizationMaxPercent}.
 * Never fires for other protocol types.
 */
@Component
@Order(3)
@RequiredArgsConstructor
public class UtilizationHighRule implements AnomalyRule {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final AppProps props;

    @Override
    public AlertKind kind() {
        return AlertKind.UTILIZATION_HIGH;
    }

    @Override
    public Optional<AlertCandidate> evaluate(SnapshotStore store, ProtocolSnapshot latest, AppProps.Protocol protocol, Instant now) {
        if (protocol == null || !protocol.isLending() || latest.getUtilizationRate() == null) {
            return Optional.empty();
        }

        BigDecimal utilizationPct = latest.getUtilizationRate().multiply(HUNDRED);
        double threshold = props.getThresholds().getUtilizationMaxPercent();
        if (utilizationPct.compareTo(BigDecimal.valueOf(threshold)) <= 0) {
            return Optional.empty();
        }

        String message = String.format(Locale.US,
                "Utilization rate critically high: %.2f%% (threshold: %.2f%%)", utilizationPct, threshold);
        return Optional.of(AlertCandidate.of(latest.getProtocolId(), kind(), message, now));
    }
}
