package com.storefront.api;

import com.storefront.common.exception.BusinessException;
import com.storefront.common.exception.ErrorCode;
import com.storefront.common.exception.GlobalExceptionHandler;
import com.storefront.domain.model.PaymentEvent;
import com.storefront.domain.service.IdempotencyService;
import com.storefront.infrastructure.messaging.PaymentEventPublisher;
import com.storefront.infrastructure.messaging.PaymentEventReader;
import com.storefront.infrastructure.persistence.entity.IdempotencyRecordEntity;
import com.storefront.infrastructure.persistence.entity.IdempotencyRecordEntity.ProcessingStatus;
import com.storefront.infrastructure.security.WebhookSignatureVerifier;
import com.storefront.testutil.TestData;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PaymentWebhookController.class)
@ContextConfiguration(classes = {
        PaymentWebhookController.class,
        GlobalExceptionHandler.class,
        WebhookSignatureVerifier.class,
        PaymentEventReader.class
})
@DisplayName("PaymentWebhookController Tests")
class PaymentWebhookControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private WebhookSignatureVerifier signatureVerifier;

    @MockBean
    private PaymentEventPublisher eventPublisher;

    @MockBean
    private IdempotencyService idempotencyService;

    @Test
    @DisplayName("POST /webhook - Signed event is queued and acknowledged")
    void webhook_ValidSignature_Returns200() throws Exception {
        // Given
        String body = TestData.chargeSuccessJson("ref-001");

        // When / Then
        mockMvc.perform(post("/api/v1/payments/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(WebhookSignatureVerifier.SIGNATURE_HEADER, signatureVerifier.sign(body))
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.received").value(true))
                .andExpect(jsonPath("$.data.reference").value("ref-001"));

        ArgumentCaptor<PaymentEvent> published = ArgumentCaptor.forClass(PaymentEvent.class);
        verify(eventPublisher).publish(published.capture());
        assertThat(published.getValue().reference()).isEqualTo("ref-001");
        assertThat(published.getValue().getRawPayload()).isEqualTo(body);
    }

    @Test
    @DisplayName("POST /webhook - Wrong signature returns 400 and nothing is queued")
    void webhook_InvalidSignature_Returns400() throws Exception {
        String body = TestData.chargeSuccessJson("ref-001");

        mockMvc.perform(post("/api/v1/payments/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(WebhookSignatureVerifier.SIGNATURE_HEADER, "deadbeef")
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_SIGNATURE"));

        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("POST /webhook - Missing signature header returns 400")
    void webhook_MissingSignature_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/payments/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(TestData.chargeSuccessJson("ref-001")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_SIGNATURE"));

        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("POST /webhook - Signed but malformed event returns 400")
    void webhook_MalformedEvent_Returns400() throws Exception {
        String body = "{\"event\":\"charge.success\",\"data\":{}}";

        mockMvc.perform(post("/api/v1/payments/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(WebhookSignatureVerifier.SIGNATURE_HEADER, signatureVerifier.sign(body))
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PAYMENT_EVENT"));

        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("POST /webhook - Queue unavailable returns 503 so the provider retries")
    void webhook_QueueDown_Returns503() throws Exception {
        String body = TestData.chargeSuccessJson("ref-001");
        doThrow(new BusinessException(ErrorCode.SERVICE_UNAVAILABLE, "Payment event queue unavailable"))
                .when(eventPublisher).publish(any());

        mockMvc.perform(post("/api/v1/payments/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(WebhookSignatureVerifier.SIGNATURE_HEADER, signatureVerifier.sign(body))
                        .content(body))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("SERVICE_UNAVAILABLE"));
    }

    @Test
    @DisplayName("GET /events - Returns the event log page")
    void events_ReturnsPage() throws Exception {
        IdempotencyRecordEntity record = IdempotencyRecordEntity.builder()
                .reference("ref-001")
                .provider(IdempotencyService.PROVIDER)
                .eventType("charge.success")
                .payload("{}")
                .status(ProcessingStatus.PROCESSED_REFUNDED)
                .attempts(1)
                .createdAt(Instant.now())
                .updatedAt(Instant.now())
                .build();
        when(idempotencyService.recent(ProcessingStatus.PROCESSED_REFUNDED, null, 0, 20))
                .thenReturn(new PageImpl<>(List.of(record), PageRequest.of(0, 20), 1));

        mockMvc.perform(get("/api/v1/payments/events").param("status", "PROCESSED_REFUNDED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.content[0].reference").value("ref-001"))
                .andExpect(jsonPath("$.data.content[0].status").value("PROCESSED_REFUNDED"))
                .andExpect(jsonPath("$.data.totalElements").value(1));
    }
}
