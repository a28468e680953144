package com.storefront.api;

import com.storefront.api.dto.ApiResponse;
import com.storefront.api.dto.PageResponse;
import com.storefront.common.exception.BusinessException;
import com.storefront.common.exception.ErrorCode;
import com.storefront.domain.model.PaymentEvent;
import com.storefront.domain.service.IdempotencyService;
import com.storefront.infrastructure.messaging.PaymentEventPublisher;
import com.storefront.infrastructure.messaging.PaymentEventReader;
import com.storefront.infrastructure.persistence.entity.IdempotencyRecordEntity;
import com.storefront.infrastructure.security.WebhookSignatureVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Payment provider webhook and the processed-event log.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
public class PaymentWebhookController {

    private final WebhookSignatureVerifier signatureVerifier;
    private final PaymentEventReader eventReader;
    private final PaymentEventPublisher eventPublisher;
    private final IdempotencyService idempotencyService;

    /**
     * Receive a provider webhook.
     *
     * POST /api/v1/payments/webhook
     *
     * The signature is checked against the raw body before anything is parsed. A verified
     * event is queued and acknowledged; processing happens on the consumer.
     */
    @PostMapping("/webhook")
    public ResponseEntity<ApiResponse<Map<String, Object>>> receiveWebhook(
            @RequestBody String rawBody,
            @RequestHeader(value = WebhookSignatureVerifier.SIGNATURE_HEADER, required = false) String signature) {

        if (!signatureVerifier.isValid(rawBody, signature)) {
            log.warn("Rejected webhook with invalid signature");
            throw new BusinessException(ErrorCode.INVALID_SIGNATURE);
        }

        PaymentEvent event = eventReader.read(rawBody);
        log.info("Received webhook {} for reference {}", event.getEvent(), event.reference());

        eventPublisher.publish(event);

        return ResponseEntity.ok(ApiResponse.ok(Map.of("received", true, "reference", event.reference())));
    }

    @GetMapping("/events")
    public ResponseEntity<ApiResponse<PageResponse<IdempotencyRecordEntity>>> events(
            @RequestParam(required = false) IdempotencyRecordEntity.ProcessingStatus status,
            @RequestParam(required = false) String eventType,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {

        return ResponseEntity.ok(ApiResponse.ok(
                PageResponse.of(idempotencyService.recent(status, eventType, page, Math.min(size, 100)))));
    }
}
