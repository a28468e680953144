package com.storefront.api.dto;

import com.storefront.infrastructure.persistence.entity.StockMovementEntity.MovementType;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

/**
 * Manual stock change by an operator. {@code quantity} is signed: negative removes stock.
 * Sales are recorded by order settlement only.
 */
public record StockAdjustmentRequest(
        @NotNull UUID variantId,
        @NotNull Integer quantity,
        @NotNull MovementType type,
        @NotBlank @Size(max = 500) String reason,
        UUID actorId) {

    @AssertTrue(message = "must not be zero")
    public boolean isQuantityNonZero() {
        return quantity == null || quantity != 0;
    }

    @AssertTrue(message = "SALE movements are recorded by order settlement")
    public boolean isTypeManual() {
        return type != MovementType.SALE;
    }
}
