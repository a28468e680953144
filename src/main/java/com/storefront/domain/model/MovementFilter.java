package com.storefront.domain.model;

import com.storefront.infrastructure.persistence.entity.StockMovementEntity.MovementType;

import java.util.UUID;

/**
 * Optional filters for the movement history. Null fields are not applied.
 */
public record MovementFilter(UUID variantId, MovementType type, Integer days) {
}
