package com.freightplatform.loadservice.model;

import com.freightplatform.loadservice.core.util.MoneyUtil;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "loads", indexes = {
        @Index(name = "idx_load_shipper", columnList = "shipper_id"),
        @Index(name = "idx_load_status", columnList = "status")
})
@Getter
@Setter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Load {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Setter(AccessLevel.NONE)
    private UUID id;

    @Column(nullable = false)
    private UUID shipperId;

    @Column(length = 64)
    private String referenceNumber;

    private String description;

    @Column(length = 20)
    @Enumerated(EnumType.STRING)
    private EquipmentType equipmentType;

    @Column(precision = 12, scale = 2)
    private BigDecimal weight;

    @Column(precision = 19, scale = 2)
    private BigDecimal offeredRate;

    // Written only through LoadRecordStore.patchStatus
    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    @Setter(AccessLevel.NONE)
    private LoadStatus status = LoadStatus.CREATED;

    @Version
    @Column(nullable = false)
    @Setter(AccessLevel.NONE)
    private long version;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    @Setter(AccessLevel.NONE)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(nullable = false)
    @Setter(AccessLevel.NONE)
    private Instant updatedAt;

    @Builder
    private Load(UUID shipperId, String referenceNumber, String description,
                 EquipmentType equipmentType, BigDecimal weight, BigDecimal offeredRate) {
        this.shipperId = shipperId;
        this.referenceNumber = referenceNumber;
        this.description = description;
        this.equipmentType = equipmentType;
        this.weight = weight;
        this.offeredRate = MoneyUtil.format(offeredRate);
        this.status = LoadStatus.CREATED;
    }
}
