package com.defimonitor.detection;

import com.defimonitor.config.AppProps;
import com.defimonitor.model.AlertKind;
import com.defimonitor.model.Severity;
import com.defimonitor.service.SnapshotStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.defimonitor.fixtures.MonitorFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.mock;

class UtilizationHighRuleTest {

    private SnapshotStore store;
    private AppProps props;
    private UtilizationHighRule rule;

    @BeforeEach
    void setUp() {
        store = mock(SnapshotStore.class);
        props = props();
        rule = new UtilizationHighRule(props);
    }

    private Optional<AlertCandidate> evaluateLending(String utilization) {
        return rule.evaluate(store, snapshot(AAVE, NOW, "1000.00", "3.0", utilization), props.require(AAVE), NOW);
    }

    @Test
    void lendingAbove95Percent_isWarning() {
        var alert = evaluateLending("0.97");

        assertThat(alert).isPresent();
        assertThat(alert.get().getKind()).isEqualTo(AlertKind.UTILIZATION_HIGH);
        assertThat(alert.get().getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(alert.get().getMessage()).isEqualTo("Utilization rate critically high: 97.00% (threshold: 95.00%)");
    }

    @Test
    void lendingAt85Percent_isIgnored() {
        assertThat(evaluateLending("0.85")).isEmpty();
    }

    @Test
    void exactlyAtMaximum_isIgnored() {
        assertThat(evaluateLending("0.95")).isEmpty();
    }

    @Test
    void unknownUtilization_isIgnored() {
        assertThat(evaluateLending(null)).isEmpty();
    }

    @Test
    void nonLendingProtocol_neverFires() {
        var dex = snapshot(UNISWAP, NOW, "1000.00", "3.0", "0.99");

        assertThat(rule.evaluate(store, dex, props.require(UNISWAP), NOW)).isEmpty();
        then(store).shouldHaveNoInteractions();
    }

    @Test
    void lendingTypeIsMatchedCaseInsensitively() {
        props.require(AAVE).setType("LENDING");

        assertThat(evaluateLending("0.99")).isPresent();
    }
}
