package com.storefront.domain.service;

import com.storefront.common.exception.BusinessException;
import com.storefront.common.exception.ErrorCode;
import com.storefront.domain.model.PaymentEvent;
import com.storefront.domain.model.PaymentEventType;
import com.storefront.domain.model.ProcessingOutcome;
import com.storefront.domain.model.VerificationResult;
import com.storefront.domain.model.VerificationResult.Action;
import com.storefront.infrastructure.client.PaymentProviderClient.VerificationData;
import com.storefront.infrastructure.client.PaymentProviderGateway;
import com.storefront.infrastructure.persistence.entity.OrderEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Asks the provider about an order whose webhook may have been lost.
 *
 * A successful payment is never written to the order directly: it is turned into a
 * charge.success event and goes through the same processor as webhooks, so it gets the
 * same idempotency and stock checks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentVerificationService {

    private final PaymentProviderGateway paymentProvider;
    private final PaymentEventProcessor processor;
    private final OrderService orderService;

    public VerificationResult verify(String orderNumber) {
        return verify(orderService.getByOrderNumber(orderNumber));
    }

    public VerificationResult verify(OrderEntity order) {
        String reference = order.getPaymentReference();
        if (reference == null || reference.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_ORDER_STATE,
                    "Order " + order.getOrderNumber() + " has no payment reference");
        }

        VerificationData verification = paymentProvider.verify(reference);
        String status = verification.status() == null ? "unknown" : verification.status();

        switch (status) {
            case "success" -> {
                ProcessingOutcome outcome = processor.process(chargeSuccess(reference, verification));
                log.info("Verified payment for order {} with provider: {}", order.getOrderNumber(), outcome);
                return new VerificationResult(order.getOrderNumber(), reference, status, Action.PROCESSED, outcome);
            }
            case "failed", "abandoned" -> {
                boolean cancelled = orderService.markPaymentFailed(reference, status);
                return new VerificationResult(order.getOrderNumber(), reference, status,
                        cancelled ? Action.CANCELLED : Action.UNCHANGED, null);
            }
            default -> {
                log.debug("Payment for order {} still {} at provider", order.getOrderNumber(), status);
                return new VerificationResult(order.getOrderNumber(), reference, status, Action.UNCHANGED, null);
            }
        }
    }

    private static PaymentEvent chargeSuccess(String reference, VerificationData verification) {
        return PaymentEvent.builder()
                .event(PaymentEventType.CHARGE_SUCCESS.getWireName())
                .data(PaymentEvent.PaymentData.builder()
                        .reference(reference)
                        .amount(verification.amount())
                        .currency(verification.currency())
                        .status(verification.status())
                        .channel(verification.channel())
                        .paidAt(verification.paidAt())
                        .gatewayResponse(verification.gatewayResponse())
                        .build())
                .build();
    }
}
