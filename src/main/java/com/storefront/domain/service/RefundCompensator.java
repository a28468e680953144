package com.storefront.domain.service;

import com.storefront.common.exception.RefundFailedException;
import com.storefront.domain.model.SettlementResult;
import com.storefront.infrastructure.client.PaymentProviderGateway;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Refunds a payment whose order could not be fulfilled.
 *
 * Compensation Flow:
 * 1. Ask the provider to refund the full transaction
 * 2. Success: order REFUNDED, customer told the order was cancelled
 * 3. Failure: order REFUND_FAILED with the error in its notes, admins alerted
 *
 * There is no automatic retry of a failed refund; an operator refunds manually.
 * Never called inside a database transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefundCompensator {

    private final PaymentProviderGateway paymentProvider;
    private final OrderService orderService;
    private final NotificationDispatcher notificationDispatcher;
    private final AdminAlertService adminAlertService;
    private final MeterRegistry meterRegistry;

    public void compensate(SettlementResult order) {
        try {
            paymentProvider.refund(order.reference());
        } catch (RefundFailedException e) {
            log.error("Refund failed for order {} (reference {}): {}",
                    order.orderNumber(), order.reference(), e.getMessage(), e);
            count("refund_failed");
            recordRefundFailure(order, e.getMessage());
            return;
        }

        log.info("Refund initiated for order {} (reference {})", order.orderNumber(), order.reference());

        try {
            orderService.markRefunded(order.orderId());
        } catch (RuntimeException e) {
            count("not_recorded");
            alert(() -> adminAlertService.refundNotRecorded(order, e.getMessage()), order);
            return;
        }

        count("refunded");
        if (order.refundReason() == SettlementResult.RefundReason.CANCELLED_BEFORE_PAYMENT) {
            notificationDispatcher.paymentRefundedAfterCancellation(order);
        } else {
            notificationDispatcher.orderCancelledForStock(order);
        }
    }

    private void recordRefundFailure(SettlementResult order, String error) {
        try {
            orderService.markRefundFailed(order.orderId(), error);
        } catch (RuntimeException e) {
            log.error("Could not record refund failure on order {}: {}", order.orderNumber(), e.getMessage(), e);
        }
        alert(() -> adminAlertService.refundFailed(order, error), order);
    }

    private void alert(Runnable alert, SettlementResult order) {
        try {
            alert.run();
        } catch (RuntimeException e) {
            log.error("Failed to alert admins about order {} (reference {}): {}",
                    order.orderNumber(), order.reference(), e.getMessage(), e);
        }
    }

    private void count(String result) {
        Counter.builder("refund.compensation")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
