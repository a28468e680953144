package com.storefront.infrastructure.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.common.exception.MalformedPaymentEventException;
import com.storefront.domain.model.PaymentEvent;
import com.storefront.domain.model.PaymentEventType;
import com.storefront.infrastructure.persistence.entity.IdempotencyRecordEntity;
import com.storefront.testutil.TestData;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PaymentEventReaderTest {

    private final PaymentEventReader reader = new PaymentEventReader(new ObjectMapper().findAndRegisterModules());

    @Test
    void read_chargeSuccess_parsedWithRawPayload() {
        String json = TestData.chargeSuccessJson("ref-001");

        PaymentEvent event = reader.read(json);

        assertEquals(PaymentEventType.CHARGE_SUCCESS, event.eventType());
        assertEquals("ref-001", event.reference());
        assertEquals(15000L, event.getData().getAmount());
        assertEquals("2024-05-01T10:00:00.000Z", event.getData().getPaidAt());
        assertEquals(json, event.getRawPayload());
    }

    @Test
    void read_unknownEventType_parsedAsUnrecognized() {
        PaymentEvent event = reader.read("{\"event\":\"subscription.create\",\"data\":{\"reference\":\"ref-9\"}}");

        assertEquals(PaymentEventType.UNRECOGNIZED, event.eventType());
    }

    @Test
    void read_invalidJson_malformed() {
        assertThrows(MalformedPaymentEventException.class, () -> reader.read("{\"event\":"));
    }

    @Test
    void read_missingReference_malformed() {
        assertThrows(MalformedPaymentEventException.class,
                () -> reader.read("{\"event\":\"charge.success\",\"data\":{\"amount\":100}}"));
    }

    @Test
    void read_referenceTooLong_malformed() {
        String json = TestData.chargeSuccessJson("r".repeat(IdempotencyRecordEntity.MAX_REFERENCE_LENGTH + 1));

        assertThrows(MalformedPaymentEventException.class, () -> reader.read(json));
    }

    @Test
    void read_missingEvent_malformed() {
        assertThrows(MalformedPaymentEventException.class,
                () -> reader.read("{\"data\":{\"reference\":\"ref-001\"}}"));
    }

    @Test
    void read_empty_malformed() {
        assertThrows(MalformedPaymentEventException.class, () -> reader.read(" "));
        assertThrows(MalformedPaymentEventException.class, () -> reader.read("null"));
    }
}
