package com.freightplatform.loadservice.repository;

import com.freightplatform.loadservice.model.StatusHistoryRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface StatusHistoryRepository extends JpaRepository<StatusHistoryRecord, UUID> {

    List<StatusHistoryRecord> findByLoadIdOrderBySequenceNumberAsc(UUID loadId);

    Optional<StatusHistoryRecord> findFirstByLoadIdOrderBySequenceNumberDesc(UUID loadId);
}
