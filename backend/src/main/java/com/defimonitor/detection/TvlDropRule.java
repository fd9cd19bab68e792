package com.defimonitor.detection;

import com.defimonitor.config.AppProps;
import com.defimonitor.model.AlertKind;
import com.defimonitor.model.ProtocolSnapshot;
import com.defimonitor.service.SnapshotStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Critical when TVL fell by at least {@code tvlDrop24hPercent} against the sample taken
 * at or before {@code now - tvlLookback}.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class TvlDropRule implements AnomalyRule {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final AppProps props;

    @Override
    public AlertKind kind() {
        return AlertKind.TVL_DROP;
    }

    @Override
    public Optional<AlertCandidate> evaluate(SnapshotStore store, ProtocolSnapshot latest, AppProps.Protocol protocol, Instant now) {
        String protocolId = latest.getProtocolId();
        if (latest.getTvlUsd() == null) {
            return Optional.empty();
        }

        Optional<ProtocolSnapshot> previous = store.asOf(protocolId, now.minus(props.getDetection().getTvlLookback()));
        if (previous.isEmpty() || previous.get().getTvlUsd() == null || previous.get().getTvlUsd().signum() <= 0) {
            log.info("No 24h historical data for {}, skipping TVL drop check", protocolId);
            return Optional.empty();
        }

        BigDecimal curr = latest.getTvlUsd();
        BigDecimal prev = previous.get().getTvlUsd();
        BigDecimal dropPct = prev.subtract(curr)
                .divide(prev, MathContext.DECIMAL64)
                .multiply(HUNDRED);

        double threshold = props.getThresholds().getTvlDrop24hPercent();
        if (dropPct.compareTo(BigDecimal.valueOf(threshold)) < 0) {
            return Optional.empty();
        }

        String message = String.format(Locale.US,
                "TVL dropped %.2f%% in 24 hours (from $%,.2f to $%,.2f)", dropPct, prev, curr);
        return Optional.of(AlertCandidate.of(protocolId, kind(), message, now));
    }
}
