package com.defimonitor.service;

import com.defimonitor.config.AppProps;
import com.defimonitor.detection.AlertCandidate;
import com.defimonitor.exception.AlertNotFoundException;
import com.defimonitor.exception.StorageException;
import com.defimonitor.model.AlertKind;
import com.defimonitor.model.ProtocolAlert;
import com.defimonitor.notify.NotificationSink;
import com.defimonitor.repo.ProtocolAlertRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Append-only alert store with deduplication.
 *
 * For a given (protocol, kind) at most one open alert is created per dedup window. The
 * check and the insert run under a lock per (protocol, kind), so a scheduled run and a
 * manually triggered one cannot both pass the check and notify twice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertLedger {

    private final ProtocolAlertRepo repo;
    private final NotificationSink notificationSink;
    private final AppProps props;
    private final Clock clock;

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /** True iff an open alert of this kind for the protocol was triggered within {@code window} before now. */
    public boolean hasRecentOpen(String protocolId, AlertKind kind, Duration window) {
        Instant since = clock.instant().minus(window);
        return query("open " + kind.getCode() + " alerts of " + protocolId,
                () -> repo.existsByProtocolIdAndKindAndResolvedAtIsNullAndTriggeredAtAfter(protocolId, kind, since));
    }

    /**
     * Inserts the candidate unless a matching open alert exists inside the dedup window, then
     * notifies. A failed notification is logged and does not undo the insert.
     */
    public SaveOutcome save(AlertCandidate candidate) {
        ReentrantLock lock = locks.computeIfAbsent(candidate.getProtocolId() + "|" + candidate.getKind(), k -> new ReentrantLock());
        ProtocolAlert saved;
        lock.lock();
        try {
            if (hasRecentOpen(candidate.getProtocolId(), candidate.getKind(), props.getDetection().getDedupWindow())) {
                log.info("Similar alert already exists for {} - {}", candidate.getProtocolId(), candidate.getKind().getCode());
                return SaveOutcome.DUPLICATE_SUPPRESSED;
            }
            ProtocolAlert row = ProtocolAlert.builder()
                    .protocolId(candidate.getProtocolId())
                    .kind(candidate.getKind())
                    .severity(candidate.getSeverity())
                    .message(candidate.getMessage())
                    .triggeredAt(candidate.getTriggeredAt())
                    .build();
            saved = query("insert of " + candidate.getKind().getCode() + " alert for " + candidate.getProtocolId(),
                    () -> repo.insert(row));
        } finally {
            lock.unlock();
        }

        log.warn("ALERT: {} - {}", saved.getSeverity().getCode().toUpperCase(Locale.ROOT), saved.getMessage());
        notifySafely(saved);
        return SaveOutcome.INSERTED;
    }

    /** Marks the alert resolved now. Resolving an already resolved alert leaves it unchanged. */
    public ProtocolAlert resolve(String alertId) {
        ProtocolAlert alert = query("alert " + alertId, () -> repo.findById(alertId))
                .orElseThrow(() -> new AlertNotFoundException(alertId));
        if (!alert.isOpen()) {
            return alert;
        }
        alert.setResolvedAt(clock.instant());
        ProtocolAlert saved = query("resolution of alert " + alertId, () -> repo.save(alert));
        log.info("Resolved alert {} ({} - {})", alertId, saved.getProtocolId(), saved.getKind().getCode());
        return saved;
    }

    public List<ProtocolAlert> open() {
        return query("open alerts", repo::findByResolvedAtIsNullOrderByTriggeredAtDesc);
    }

    /** Latest 100 resolved alerts. */
    public List<ProtocolAlert> resolved() {
        return query("resolved alerts", repo::findTop100ByResolvedAtIsNotNullOrderByTriggeredAtDesc);
    }

    /** Latest 100 alerts of any status. */
    public List<ProtocolAlert> all() {
        return query("alerts", repo::findTop100ByOrderByTriggeredAtDesc);
    }

    public List<ProtocolAlert> openSince(String protocolId, Instant since) {
        return query("open alerts of " + protocolId,
                () -> repo.findByProtocolIdAndResolvedAtIsNullAndTriggeredAtAfter(protocolId, since));
    }

    private void notifySafely(ProtocolAlert alert) {
        try {
            if (!notificationSink.send(alert)) {
                log.debug("Notification not delivered for alert {}", alert.getId());
            }
        } catch (RuntimeException e) {
            log.error("Failed to send notification for alert {}: {}", alert.getId(), e.getMessage());
        }
    }

    private static <T> T query(String what, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to access " + what + ": " + e.getMessage(), e);
        }
    }
}
