package com.defimonitor.repo;

import com.defimonitor.model.AlertKind;
import com.defimonitor.model.ProtocolAlert;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface ProtocolAlertRepo extends MongoRepository<ProtocolAlert, String> {

    /** Dedup check: an unresolved alert of this kind raised after {@code since}. */
    boolean existsByProtocolIdAndKindAndResolvedAtIsNullAndTriggeredAtAfter(
            String protocolId, AlertKind kind, Instant since);

    List<ProtocolAlert> findByProtocolIdAndResolvedAtIsNullAndTriggeredAtAfter(String protocolId, Instant since);

    List<ProtocolAlert> findByResolvedAtIsNullOrderByTriggeredAtDesc();

    List<ProtocolAlert> findTop100ByResolvedAtIsNotNullOrderByTriggeredAtDesc();

    List<ProtocolAlert> findTop100ByOrderByTriggeredAtDesc();
}
