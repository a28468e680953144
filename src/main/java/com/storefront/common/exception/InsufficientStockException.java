package com.storefront.common.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Thrown by the stock ledger when a decrement would take a variant below zero.
 */
@Getter
public class InsufficientStockException extends BusinessException {

    private final UUID variantId;
    private final int available;
    private final int requested;

    public InsufficientStockException(UUID variantId, int available, int requested) {
        super(ErrorCode.INSUFFICIENT_STOCK,
                String.format("Insufficient stock. Current: %d, Requested: %d", available, requested));
        this.variantId = variantId;
        this.available = available;
        this.requested = requested;
    }
}
