package com.storefront.domain.model;

import java.util.UUID;

public record LowStockVariant(UUID variantId, String sku, String productName, int stock, int suggestedReorder) {
}
