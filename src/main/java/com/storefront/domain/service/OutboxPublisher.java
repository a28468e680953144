package com.storefront.domain.service;

import com.storefront.infrastructure.persistence.entity.OutboxEventEntity;
import com.storefront.infrastructure.persistence.repository.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Relays outbox rows to Kafka.
 *
 * Each row names its own topic. A row is marked PUBLISHED only after the broker
 * acknowledged it; a failed send stays PENDING and is retried on the next poll until it
 * has used {@code app.outbox.max-attempts}, after which it is parked as FAILED.
 * Consumers of the relayed topics must tolerate duplicates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxPublisher {

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;

    @Value("${app.outbox.max-attempts:5}")
    private int maxAttempts;

    @Value("${app.outbox.send-timeout-ms:5000}")
    private long sendTimeoutMs;

    @Scheduled(fixedDelayString = "${app.outbox.polling-interval-ms:1000}")
    @Transactional
    public void publishPendingEvents() {
        List<OutboxEventEntity> pendingEvents = outboxEventRepository
                .findTop50ByStatusOrderByCreatedAtAsc(OutboxEventEntity.EventStatus.PENDING);

        if (pendingEvents.isEmpty()) {
            return;
        }

        log.debug("Publishing {} pending outbox events", pendingEvents.size());

        for (OutboxEventEntity event : pendingEvents) {
            try {
                kafkaTemplate.send(event.getTopic(), event.getMessageKey(), event.getPayload())
                        .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

                event.markPublished();
                log.debug("Published outbox event {} to topic {}", event.getEventId(), event.getTopic());

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                event.recordFailure("interrupted", maxAttempts);
                log.warn("Outbox relay interrupted at event {}", event.getEventId());
                break;

            } catch (ExecutionException | TimeoutException e) {
                event.recordFailure(e.getMessage(), maxAttempts);
                log.error("Failed to publish outbox event {} (attempt {}): {}",
                        event.getEventId(), event.getRetryCount(), e.getMessage());
            }
        }

        outboxEventRepository.saveAll(pendingEvents);
    }
}
