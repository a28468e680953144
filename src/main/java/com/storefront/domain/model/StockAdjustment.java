package com.storefront.domain.model;

import com.storefront.infrastructure.persistence.entity.StockMovementEntity;

import java.util.UUID;

public record StockAdjustment(UUID variantId, String sku, int previousStock, int newStock,
                              StockMovementEntity movement) {
}
