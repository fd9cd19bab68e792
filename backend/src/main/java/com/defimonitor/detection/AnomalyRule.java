package com.defimonitor.detection;

import com.defimonitor.config.AppProps;
import com.defimonitor.model.AlertKind;
import com.defimonitor.model.ProtocolSnapshot;
import com.defimonitor.service.SnapshotStore;

import java.time.Instant;
import java.util.Optional;

/**
 * Threshold check over stored snapshots of one protocol.
 * Implementations hold no state of their own; running them in any order gives the same candidates.
 * All rules of one run see the same latest snapshot, read once by the caller.
 */
public interface AnomalyRule {

    AlertKind kind();

    /**
     * @param store    for look-back reads; the latest sample is passed in, not re-read
     * @param latest   newest stored snapshot of the protocol, never null
     * @param protocol its static metadata
     * @param now      evaluation instant, also used as the candidate's trigger time
     * @return a candidate when the condition holds, empty when it does not or data is missing
     */
    Optional<AlertCandidate> evaluate(SnapshotStore store, ProtocolSnapshot latest, AppProps.Protocol protocol, Instant now);
}
