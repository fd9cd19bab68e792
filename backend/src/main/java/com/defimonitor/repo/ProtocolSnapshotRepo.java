package com.defimonitor.repo;

import com.defimonitor.model.ProtocolSnapshot;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ProtocolSnapshotRepo extends MongoRepository<ProtocolSnapshot, String> {

    Optional<ProtocolSnapshot> findTopByProtocolIdOrderByTsDesc(String protocolId);

    /** Latest snapshot at or before a given timestamp T; used to look back "N hours ago". */
    Optional<ProtocolSnapshot> findTopByProtocolIdAndTsLessThanEqualOrderByTsDesc(String protocolId, Instant ts);

    Optional<ProtocolSnapshot> findByProtocolIdAndTs(String protocolId, Instant ts);

    boolean existsByProtocolIdAndTs(String protocolId, Instant ts);

    List<ProtocolSnapshot> findByProtocolIdAndTsAfterOrderByTsDesc(String protocolId, Instant from);
}
