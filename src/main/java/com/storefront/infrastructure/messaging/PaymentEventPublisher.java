package com.storefront.infrastructure.messaging;

import com.storefront.common.exception.BusinessException;
import com.storefront.common.exception.ErrorCode;
import com.storefront.domain.model.PaymentEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Hands verified webhook payloads to the payment-events topic.
 *
 * Keyed by reference so every delivery of one payment lands on the same partition.
 * The send is confirmed before the webhook is acknowledged; if the broker cannot take it
 * the provider gets an error and delivers again.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;

    @Value("${app.kafka.topics.payment-events}")
    private String paymentEventsTopic;

    @Value("${app.kafka.send-timeout-ms:5000}")
    private long sendTimeoutMs;

    public void publish(PaymentEvent event) {
        try {
            kafkaTemplate.send(paymentEventsTopic, event.reference(), event.getRawPayload())
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS);
            log.info("Queued payment event {} ({})", event.reference(), event.getEvent());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.SERVICE_UNAVAILABLE,
                    "Interrupted while queueing payment event " + event.reference(), e);

        } catch (ExecutionException | TimeoutException e) {
            log.error("Failed to queue payment event {}: {}", event.reference(), e.getMessage(), e);
            throw new BusinessException(ErrorCode.SERVICE_UNAVAILABLE,
                    "Could not queue payment event " + event.reference(), e);
        }
    }
}
