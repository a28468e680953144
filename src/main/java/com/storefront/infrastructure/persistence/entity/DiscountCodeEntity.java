package com.storefront.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Entity
@Table(name = "discount_codes")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscountCodeEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID discountCodeId;

    @Column(nullable = false, unique = true, length = 50)
    private String code;

    @Column(nullable = false)
    private Integer usedCount;

    @PrePersist
    protected void onCreate() {
        if (discountCodeId == null) {
            discountCodeId = UUID.randomUUID();
        }
        if (usedCount == null) {
            usedCount = 0;
        }
    }
}
