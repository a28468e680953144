package com.storefront.domain.model;

import com.storefront.infrastructure.persistence.entity.OrderEntity;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Committed result of settling one order against a confirmed payment.
 *
 * Carries a snapshot of the order so post-commit work never has to reload it.
 */
public record SettlementResult(
        Status status,
        String reference,
        UUID orderId,
        String orderNumber,
        UUID userId,
        String customerEmail,
        BigDecimal total,
        List<StockShortage> shortages,
        RefundReason refundReason) {

    public enum Status {
        PAID,
        REFUND_REQUIRED,
        ALREADY_SETTLED
    }

    /** Why a REFUND_REQUIRED order is refunded; null for the other statuses. */
    public enum RefundReason {
        INSUFFICIENT_STOCK,
        CANCELLED_BEFORE_PAYMENT
    }

    public static SettlementResult paid(OrderEntity order) {
        return of(Status.PAID, order, List.of(), null);
    }

    public static SettlementResult refundRequired(OrderEntity order, List<StockShortage> shortages) {
        return of(Status.REFUND_REQUIRED, order, shortages, RefundReason.INSUFFICIENT_STOCK);
    }

    public static SettlementResult cancelledBeforePayment(OrderEntity order) {
        return of(Status.REFUND_REQUIRED, order, List.of(), RefundReason.CANCELLED_BEFORE_PAYMENT);
    }

    public static SettlementResult alreadySettled(OrderEntity order) {
        return of(Status.ALREADY_SETTLED, order, List.of(), null);
    }

    private static SettlementResult of(Status status, OrderEntity order, List<StockShortage> shortages,
                                       RefundReason refundReason) {
        return new SettlementResult(status, order.getPaymentReference(), order.getOrderId(),
                order.getOrderNumber(), order.getUserId(), order.getCustomerEmail(), order.getTotal(),
                List.copyOf(shortages), refundReason);
    }
}
