package com.freightplatform.loadservice.model;

import com.freightplatform.loadservice.core.util.JsonMapConverter;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One entry of a load's status ledger. Rows are insert-only and disappear only when
 * the whole load is deleted.
 */
@Entity
@Immutable
@Table(name = "load_status_history",
        indexes = @Index(name = "idx_history_load", columnList = "load_id"),
        uniqueConstraints = @UniqueConstraint(name = "uq_history_load_sequence",
                columnNames = {"load_id", "sequence_number"}))
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
public class StatusHistoryRecord {

    public static final int ACTOR_MAX_LENGTH = 100;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false)
    private UUID loadId;

    // 1-based, orders the ledger and breaks createdAt ties
    @Column(nullable = false, updatable = false)
    private long sequenceNumber;

    @Column(nullable = false, length = 20, updatable = false)
    @Enumerated(EnumType.STRING)
    private LoadStatus status;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "text", updatable = false)
    private Map<String, Object> details;

    @Column(nullable = false, length = ACTOR_MAX_LENGTH, updatable = false)
    private String actor;

    private Double latitude;

    private Double longitude;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;
}
