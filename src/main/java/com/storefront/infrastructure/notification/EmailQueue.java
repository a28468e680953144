package com.storefront.infrastructure.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.domain.model.EmailMessage;
import com.storefront.infrastructure.persistence.entity.OutboxEventEntity;
import com.storefront.infrastructure.persistence.repository.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Queue of outgoing emails, backed by the outbox table.
 *
 * Enqueueing only writes a row; {@code OutboxPublisher} relays it to the email-jobs topic
 * where the mail worker picks it up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EmailQueue {

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    @Value("${app.kafka.topics.email-jobs}")
    private String emailJobsTopic;

    @Transactional
    public UUID enqueue(EmailMessage message) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize email job " + message.type(), e);
        }

        OutboxEventEntity row = outboxEventRepository.save(OutboxEventEntity.builder()
                .eventType(message.type())
                .topic(emailJobsTopic)
                .messageKey(message.toEmail())
                .payload(payload)
                .build());

        log.debug("Queued {} email to {} ({})", message.type(), message.toEmail(), row.getEventId());
        return row.getEventId();
    }
}
