package com.storefront.infrastructure.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.common.exception.MalformedPaymentEventException;
import com.storefront.domain.model.PaymentEvent;
import com.storefront.infrastructure.persistence.entity.IdempotencyRecordEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Parses raw provider payloads, keeping the original text on the event.
 */
@Component
@RequiredArgsConstructor
public class PaymentEventReader {

    private final ObjectMapper objectMapper;

    public PaymentEvent read(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MalformedPaymentEventException("Empty payment event payload");
        }

        PaymentEvent event;
        try {
            event = objectMapper.readValue(payload, PaymentEvent.class);
        } catch (JsonProcessingException e) {
            throw new MalformedPaymentEventException("Payment event is not valid JSON: " + e.getOriginalMessage(), e);
        }

        if (event == null) {
            throw new MalformedPaymentEventException("Payment event payload is null");
        }
        if (event.getEvent() == null || event.getEvent().isBlank()) {
            throw new MalformedPaymentEventException("Payment event has no event type");
        }
        if (event.reference() == null || event.reference().isBlank()) {
            throw new MalformedPaymentEventException("Payment event " + event.getEvent() + " has no reference");
        }
        if (event.reference().length() > IdempotencyRecordEntity.MAX_REFERENCE_LENGTH) {
            throw new MalformedPaymentEventException("Payment event reference exceeds "
                    + IdempotencyRecordEntity.MAX_REFERENCE_LENGTH + " characters");
        }

        event.setRawPayload(payload);
        return event;
    }
}
