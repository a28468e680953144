package com.storefront.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Check;

import java.time.Instant;
import java.util.UUID;

/**
 * A sellable product variant and its current stock.
 *
 * Stock is only ever changed through {@code StockLedgerService}; the check constraint
 * makes a negative value unrepresentable even if that rule is broken.
 */
@Entity
@Table(name = "variants", indexes = {
    @Index(name = "idx_variants_sku", columnList = "sku", unique = true),
    @Index(name = "idx_variants_stock", columnList = "active,stock")
})
@Check(constraints = "stock >= 0")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VariantEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID variantId;

    @Column(nullable = false, unique = true, length = 100)
    private String sku;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID productId;

    @Column(nullable = false, length = 255)
    private String productName;

    @Column(nullable = false)
    private Integer stock;

    @Column(nullable = false)
    @Builder.Default
    private Boolean active = Boolean.TRUE;

    @Column(nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (variantId == null) {
            variantId = UUID.randomUUID();
        }
        if (updatedAt == null) {
            updatedAt = Instant.now();
        }
        if (stock == null) {
            stock = 0;
        }
    }
}
