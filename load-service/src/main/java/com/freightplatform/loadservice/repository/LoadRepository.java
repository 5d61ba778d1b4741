package com.freightplatform.loadservice.repository;

import com.freightplatform.loadservice.model.Load;
import com.freightplatform.loadservice.model.LoadStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LoadRepository extends JpaRepository<Load, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM Load l WHERE l.id = :id")
    Optional<Load> findByIdForUpdate(@Param("id") UUID id);

    // Version guarded: returns 0 when another writer got there first
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE Load l
        SET l.status = :status, l.updatedAt = :updatedAt, l.version = l.version + 1
        WHERE l.id = :id AND l.version = :expectedVersion
        """)
    int updateStatus(
            @Param("id") UUID id,
            @Param("expectedVersion") long expectedVersion,
            @Param("status") LoadStatus status,
            @Param("updatedAt") Instant updatedAt
    );

    @Query("SELECT l.status AS status, COUNT(l) AS total FROM Load l GROUP BY l.status")
    List<StatusCount> countGroupedByStatus();

    @Query("""
        SELECT l.status AS status, COUNT(l) AS total
        FROM Load l
        WHERE l.shipperId = :shipperId
        GROUP BY l.status
        """)
    List<StatusCount> countGroupedByStatusForShipper(@Param("shipperId") UUID shipperId);

    interface StatusCount {
        LoadStatus getStatus();

        long getTotal();
    }
}
