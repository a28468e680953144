package com.storefront.domain.model;

import com.storefront.infrastructure.persistence.entity.StockMovementEntity.MovementType;

import java.util.UUID;

/**
 * Published by the stock ledger for every applied adjustment.
 */
public record StockLevelChangedEvent(UUID variantId, String sku, String productName,
                                     int previousStock, int newStock, MovementType type) {
}
