package com.storefront.domain.model;

import java.util.UUID;

public record StockShortage(UUID variantId, String sku, String productName, int available, int requested) {

    public String describe() {
        return sku + ": needed " + requested + ", had " + available;
    }
}
