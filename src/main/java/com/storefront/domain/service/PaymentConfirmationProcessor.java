package com.storefront.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.common.exception.EventInProgressException;
import com.storefront.common.exception.MalformedPaymentEventException;
import com.storefront.domain.model.BeginResult;
import com.storefront.domain.model.PaymentEvent;
import com.storefront.domain.model.PaymentEventType;
import com.storefront.domain.model.ProcessingOutcome;
import com.storefront.domain.model.SettlementResult;
import com.storefront.infrastructure.persistence.entity.IdempotencyRecordEntity;
import com.storefront.infrastructure.persistence.entity.IdempotencyRecordEntity.ProcessingStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Payment confirmation processor with at-most-once business effect.
 *
 * Processing Flow:
 * 1. Validate the event (type and reference are required)
 * 2. Claim the reference in the event log (duplicate detection)
 * 3. Settle the order in one transaction (see {@link StockSettlementService})
 * 4. After commit: notify the customer, or start the refund
 *
 * Delivery Guarantees:
 * - Redelivery of a processed reference is a no-op
 * - Concurrent delivery of the same reference: one wins, the other gets
 *   {@link EventInProgressException} and is redelivered later
 * - A failed attempt leaves the record FAILED; the next delivery reclaims it
 *
 * Post-commit work never changes the outcome: notification and refund failures are
 * handled where they happen.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentConfirmationProcessor implements PaymentEventProcessor {

    private final IdempotencyService idempotencyService;
    private final StockSettlementService settlementService;
    private final RefundCompensator refundCompensator;
    private final NotificationDispatcher notificationDispatcher;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    @Override
    public ProcessingOutcome process(PaymentEvent event) {
        validate(event);

        String reference = event.reference();
        PaymentEventType type = event.eventType();

        BeginResult claim = idempotencyService.begin(reference, event.getEvent(), payloadOf(event));
        switch (claim.outcome()) {
            case ALREADY_PROCESSED -> {
                log.info("Payment event {} ({}) already processed, skipping", reference, event.getEvent());
                count(ProcessingOutcome.DUPLICATE);
                return ProcessingOutcome.DUPLICATE;
            }
            case IN_PROGRESS -> {
                count("in_progress");
                throw new EventInProgressException(reference);
            }
            case STARTED -> log.info("Processing payment event {} ({})", reference, event.getEvent());
        }

        SettlementResult settlement;
        try {
            settlement = switch (type) {
                case CHARGE_SUCCESS -> settlementService.settle(reference);
                case CHARGE_FAILED, REFUND_PROCESSED, REFUND_FAILED, TRANSFER_SUCCESS, UNRECOGNIZED -> {
                    idempotencyService.complete(reference, ProcessingStatus.IGNORED, null);
                    yield null;
                }
            };
        } catch (RuntimeException e) {
            log.error("Failed to process payment event {}: {}", reference, e.getMessage(), e);
            count("error");
            markFailed(reference, e);
            throw e;
        }

        if (settlement == null) {
            log.info("Ignored payment event {} of type {}", reference, event.getEvent());
            count(ProcessingOutcome.IGNORED);
            return ProcessingOutcome.IGNORED;
        }

        ProcessingOutcome outcome = switch (settlement.status()) {
            case PAID -> {
                notificationDispatcher.paymentConfirmed(settlement);
                yield ProcessingOutcome.PAID;
            }
            case REFUND_REQUIRED -> {
                refundCompensator.compensate(settlement);
                yield ProcessingOutcome.REFUND_REQUIRED;
            }
            case ALREADY_SETTLED -> ProcessingOutcome.ALREADY_SETTLED;
        };

        count(outcome);
        return outcome;
    }

    private void validate(PaymentEvent event) {
        if (event == null) {
            throw new MalformedPaymentEventException("Payment event is missing");
        }
        if (event.getEvent() == null || event.getEvent().isBlank()) {
            throw new MalformedPaymentEventException("Payment event has no event type");
        }
        String reference = event.reference();
        if (reference == null || reference.isBlank()) {
            throw new MalformedPaymentEventException("Payment event " + event.getEvent() + " has no reference");
        }
        if (reference.length() > IdempotencyRecordEntity.MAX_REFERENCE_LENGTH) {
            throw new MalformedPaymentEventException("Payment event reference exceeds "
                    + IdempotencyRecordEntity.MAX_REFERENCE_LENGTH + " characters");
        }
    }

    private String payloadOf(PaymentEvent event) {
        if (event.getRawPayload() != null) {
            return event.getRawPayload();
        }
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new MalformedPaymentEventException("Payment event " + event.reference() + " cannot be serialized", e);
        }
    }

    private void markFailed(String reference, RuntimeException cause) {
        try {
            idempotencyService.fail(reference, cause.getMessage());
        } catch (RuntimeException e) {
            log.error("Could not mark payment event {} as failed: {}", reference, e.getMessage(), e);
            cause.addSuppressed(e);
        }
    }

    private void count(ProcessingOutcome outcome) {
        count(outcome.name().toLowerCase(Locale.ROOT));
    }

    private void count(String result) {
        Counter.builder("payment.events.processed")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
