package com.storefront.domain.model;

public record StockSummary(
        long totalVariants,
        long inStock,
        long lowStock,
        long outOfStock,
        long totalUnits,
        long movementsToday,
        long movementsLast7Days,
        int lowStockThreshold) {
}
