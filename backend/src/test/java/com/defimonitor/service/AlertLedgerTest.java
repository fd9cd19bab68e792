package com.defimonitor.service;

import com.defimonitor.config.AppProps;
import com.defimonitor.exception.AlertNotFoundException;
import com.defimonitor.exception.StorageException;
import com.defimonitor.model.AlertKind;
import com.defimonitor.model.ProtocolAlert;
import com.defimonitor.notify.NotificationSink;
import com.defimonitor.repo.ProtocolAlertRepo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.defimonitor.fixtures.MonitorFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;

class AlertLedgerTest {

    private final List<ProtocolAlert> stored = new CopyOnWriteArrayList<>();

    private ProtocolAlertRepo repo;
    private NotificationSink sink;
    private AppProps props;
    private AlertLedger ledger;

    @BeforeEach
    void setUp() {
        repo = mock(ProtocolAlertRepo.class);
        sink = mock(NotificationSink.class);
        props = props();
        ledger = new AlertLedger(repo, sink, props, CLOCK);

        // in-memory stand-in for the protocol_alerts collection
        given(repo.existsByProtocolIdAndKindAndResolvedAtIsNullAndTriggeredAtAfter(anyString(), any(), any()))
                .willAnswer(inv -> {
                    String protocolId = inv.getArgument(0);
                    AlertKind kind = inv.getArgument(1);
                    Instant since = inv.getArgument(2);
                    return stored.stream().anyMatch(a -> a.getProtocolId().equals(protocolId)
                            && a.getKind() == kind
                            && a.isOpen()
                            && a.getTriggeredAt().isAfter(since));
                });
        given(repo.insert(any(ProtocolAlert.class))).willAnswer(inv -> {
            ProtocolAlert a = inv.getArgument(0);
            a.setId(UUID.randomUUID().toString());
            stored.add(a);
            return a;
        });
        given(sink.send(any())).willReturn(true);
    }

    @Test
    void sameKindTwiceInsideWindow_insertsAndNotifiesOnce() {
        var first = ledger.save(candidate(AAVE, AlertKind.TVL_DROP));
        var second = ledger.save(candidate(AAVE, AlertKind.TVL_DROP));

        assertThat(first).isEqualTo(SaveOutcome.INSERTED);
        assertThat(second).isEqualTo(SaveOutcome.DUPLICATE_SUPPRESSED);
        assertThat(stored).hasSize(1);
        then(sink).should(times(1)).send(any());
    }

    @Test
    void insertedAlertIsOpenAndCarriesCandidateFields() {
        ledger.save(candidate(AAVE, AlertKind.APY_LOW));

        var row = stored.get(0);
        assertThat(row.getId()).isNotNull();
        assertThat(row.getResolvedAt()).isNull();
        assertThat(row.getProtocolId()).isEqualTo(AAVE);
        assertThat(row.getKind()).isEqualTo(AlertKind.APY_LOW);
        assertThat(row.getSeverity()).isEqualTo(AlertKind.APY_LOW.getSeverity());
        assertThat(row.getTriggeredAt()).isEqualTo(NOW);
    }

    @Test
    void differentKindOrProtocol_isNotADuplicate() {
        assertThat(ledger.save(candidate(AAVE, AlertKind.TVL_DROP))).isEqualTo(SaveOutcome.INSERTED);
        assertThat(ledger.save(candidate(AAVE, AlertKind.APY_LOW))).isEqualTo(SaveOutcome.INSERTED);
        assertThat(ledger.save(candidate(UNISWAP, AlertKind.TVL_DROP))).isEqualTo(SaveOutcome.INSERTED);
    }

    @Test
    void resolvedAlert_doesNotSuppress() {
        stored.add(alert("a1", AAVE, AlertKind.TVL_DROP, NOW.minus(Duration.ofMinutes(10)), NOW.minus(Duration.ofMinutes(5))));

        assertThat(ledger.save(candidate(AAVE, AlertKind.TVL_DROP))).isEqualTo(SaveOutcome.INSERTED);
    }

    @Test
    void openAlertOlderThanWindow_doesNotSuppress() {
        stored.add(alert("a1", AAVE, AlertKind.TVL_DROP, NOW.minus(Duration.ofHours(2)), null));

        assertThat(ledger.save(candidate(AAVE, AlertKind.TVL_DROP))).isEqualTo(SaveOutcome.INSERTED);
    }

    @Test
    void configuredWindowIsUsedForDedupCheck() {
        props.getDetection().setDedupWindow(Duration.ofHours(3));
        stored.add(alert("a1", AAVE, AlertKind.TVL_DROP, NOW.minus(Duration.ofHours(2)), null));

        assertThat(ledger.save(candidate(AAVE, AlertKind.TVL_DROP))).isEqualTo(SaveOutcome.DUPLICATE_SUPPRESSED);
        then(repo).should().existsByProtocolIdAndKindAndResolvedAtIsNullAndTriggeredAtAfter(
                AAVE, AlertKind.TVL_DROP, NOW.minus(Duration.ofHours(3)));
    }

    @Test
    void failedNotification_keepsInsert() {
        given(sink.send(any())).willReturn(false);

        assertThat(ledger.save(candidate(AAVE, AlertKind.TVL_DROP))).isEqualTo(SaveOutcome.INSERTED);
        assertThat(stored).hasSize(1);
    }

    @Test
    void throwingSink_keepsInsert() {
        given(sink.send(any())).willThrow(new IllegalStateException("webhook down"));

        assertThat(ledger.save(candidate(AAVE, AlertKind.TVL_DROP))).isEqualTo(SaveOutcome.INSERTED);
        assertThat(stored).hasSize(1);
    }

    @Test
    void suppressedDuplicate_isNeverNotified() {
        stored.add(alert("a1", AAVE, AlertKind.UTILIZATION_HIGH, NOW.minus(Duration.ofMinutes(30)), null));

        ledger.save(candidate(AAVE, AlertKind.UTILIZATION_HIGH));

        then(sink).should(never()).send(any());
        then(repo).should(never()).insert(any(ProtocolAlert.class));
    }

    @Test
    void concurrentSavesOfSameKind_insertExactlyOnce() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<SaveOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return ledger.save(candidate(AAVE, AlertKind.TVL_DROP));
                }));
            }
            start.countDown();

            List<SaveOutcome> outcomes = new ArrayList<>();
            for (Future<SaveOutcome> f : futures) {
                outcomes.add(f.get(10, TimeUnit.SECONDS));
            }

            assertThat(outcomes).filteredOn(o -> o == SaveOutcome.INSERTED).hasSize(1);
            assertThat(outcomes).filteredOn(o -> o == SaveOutcome.DUPLICATE_SUPPRESSED).hasSize(threads - 1);
            assertThat(stored).hasSize(1);
            then(sink).should(times(1)).send(any());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void insertFailure_raisesStorageExceptionWithoutNotifying() {
        willThrow(new DataAccessResourceFailureException("down")).given(repo).insert(any(ProtocolAlert.class));

        assertThatThrownBy(() -> ledger.save(candidate(AAVE, AlertKind.TVL_DROP)))
                .isInstanceOf(StorageException.class);
        then(sink).should(never()).send(any());
    }

    @Test
    void resolve_setsResolutionTime() {
        var open = alert("a1", AAVE, AlertKind.TVL_DROP, NOW.minus(Duration.ofMinutes(10)), null);
        given(repo.findById("a1")).willReturn(Optional.of(open));
        given(repo.save(any(ProtocolAlert.class))).willAnswer(inv -> inv.getArgument(0));

        var resolved = ledger.resolve("a1");

        assertThat(resolved.getResolvedAt()).isEqualTo(NOW);
        assertThat(resolved.isOpen()).isFalse();
    }

    @Test
    void resolveAlreadyResolved_isUnchanged() {
        var done = alert("a1", AAVE, AlertKind.TVL_DROP, NOW.minus(Duration.ofHours(3)), NOW.minus(Duration.ofHours(1)));
        given(repo.findById("a1")).willReturn(Optional.of(done));

        assertThat(ledger.resolve("a1").getResolvedAt()).isEqualTo(NOW.minus(Duration.ofHours(1)));
        then(repo).should(never()).save(any(ProtocolAlert.class));
    }

    @Test
    void resolveUnknown_throws() {
        given(repo.findById("nope")).willReturn(Optional.empty());

        assertThatThrownBy(() -> ledger.resolve("nope")).isInstanceOf(AlertNotFoundException.class);
    }
}
