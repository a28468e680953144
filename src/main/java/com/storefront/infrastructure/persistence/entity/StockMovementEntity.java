package com.storefront.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only record of a single stock change.
 *
 * previousStock and newStock are snapshots taken inside the adjusting transaction and
 * always differ by exactly {@code quantity}.
 */
@Entity
@Table(name = "stock_movements", indexes = {
    @Index(name = "idx_movements_variant_created", columnList = "variantId,createdAt"),
    @Index(name = "idx_movements_order", columnList = "orderId"),
    @Index(name = "idx_movements_created", columnList = "createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockMovementEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID movementId;

    @Column(nullable = false, columnDefinition = "UUID", updatable = false)
    private UUID variantId;

    @Column(columnDefinition = "UUID", updatable = false)
    private UUID orderId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private MovementType type;

    @Column(nullable = false, updatable = false)
    private Integer quantity;

    @Column(nullable = false, updatable = false)
    private Integer previousStock;

    @Column(nullable = false, updatable = false)
    private Integer newStock;

    @Column(length = 500, updatable = false)
    private String reason;

    @Column(columnDefinition = "UUID", updatable = false)
    private UUID createdBy;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    public enum MovementType {
        SALE,
        ADJUSTMENT,
        RETURN,
        RESTOCK
    }

    @PrePersist
    protected void onCreate() {
        if (movementId == null) {
            movementId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
