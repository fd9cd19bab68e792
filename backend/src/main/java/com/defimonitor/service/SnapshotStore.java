package com.defimonitor.service;

import com.defimonitor.exception.StorageException;
import com.defimonitor.model.ProtocolSnapshot;
import com.defimonitor.repo.ProtocolSnapshotRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Time-ordered per-protocol snapshot history.
 * Appends are idempotent on (protocolId, ts): a repeated write is a no-op, never an update.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotStore {

    private final ProtocolSnapshotRepo repo;

    public Optional<ProtocolSnapshot> latest(String protocolId) {
        return query("latest snapshot of " + protocolId,
                () -> repo.findTopByProtocolIdOrderByTsDesc(protocolId));
    }

    /**
     * Freshest snapshot at or before {@code cutoff}. This is not interpolation: with a sampling
     * cadence longer than the look-back, the returned sample can be noticeably older than the cutoff.
     */
    public Optional<ProtocolSnapshot> asOf(String protocolId, Instant cutoff) {
        return query("snapshot of " + protocolId + " as of " + cutoff,
                () -> repo.findTopByProtocolIdAndTsLessThanEqualOrderByTsDesc(protocolId, cutoff));
    }

    /** Snapshots newer than {@code since}, newest first. */
    public List<ProtocolSnapshot> history(String protocolId, Instant since) {
        return query("history of " + protocolId,
                () -> repo.findByProtocolIdAndTsAfterOrderByTsDesc(protocolId, since));
    }

    /**
     * @return true when inserted, false when a snapshot with the same (protocolId, ts) already exists
     */
    public boolean append(ProtocolSnapshot snapshot) {
        try {
            if (repo.existsByProtocolIdAndTs(snapshot.getProtocolId(), snapshot.getTs())) {
                log.debug("[snapshots] {} at {} already stored", snapshot.getProtocolId(), snapshot.getTs());
                return false;
            }
            repo.insert(snapshot);
            return true;
        } catch (DuplicateKeyException e) {
            // lost the race against a concurrent writer of the same key
            log.debug("[snapshots] {} at {} inserted concurrently", snapshot.getProtocolId(), snapshot.getTs());
            return false;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to append snapshot for " + snapshot.getProtocolId() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Seed-only path: inserts the snapshot, or replaces the TVL of the one already stored under the same key.
     * Normal ingestion must go through {@link #append(ProtocolSnapshot)}.
     */
    public ProtocolSnapshot overwriteTvl(ProtocolSnapshot snapshot) {
        try {
            Optional<ProtocolSnapshot> existing = repo.findByProtocolIdAndTs(snapshot.getProtocolId(), snapshot.getTs());
            if (existing.isEmpty()) {
                return repo.insert(snapshot);
            }
            ProtocolSnapshot cur = existing.get();
            cur.setTvlUsd(snapshot.getTvlUsd());
            log.warn("[snapshots] overwriting TVL of {} at {}", cur.getProtocolId(), cur.getTs());
            return repo.save(cur);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to overwrite snapshot for " + snapshot.getProtocolId() + ": " + e.getMessage(), e);
        }
    }

    private static <T> T query(String what, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read " + what + ": " + e.getMessage(), e);
        }
    }
}
