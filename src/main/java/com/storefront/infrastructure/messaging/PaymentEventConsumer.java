package com.storefront.infrastructure.messaging;

import com.storefront.common.exception.MalformedPaymentEventException;
import com.storefront.domain.model.PaymentEvent;
import com.storefront.domain.model.ProcessingOutcome;
import com.storefront.domain.service.PaymentEventProcessor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.DltHandler;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.annotation.RetryableTopic;
import org.springframework.kafka.retrytopic.TopicSuffixingStrategy;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.retry.annotation.Backoff;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Kafka consumer for payment provider events.
 *
 * Architecture:
 * - Thin adapter: parse, then hand over to {@link PaymentEventProcessor}
 * - Failures are rethrown so the retry topics redeliver (1s, 2s, 4s)
 * - Malformed payloads skip the retries and go straight to the dead letter topic
 * - Dead-lettered events are logged for manual intervention
 *
 * Idempotency lives in the processor, so redelivery of an already processed event is safe.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentEventConsumer {

    private final PaymentEventReader eventReader;
    private final PaymentEventProcessor processor;
    private final MeterRegistry meterRegistry;

    @RetryableTopic(
            attempts = "${app.kafka.retry.attempts:4}",
            backoff = @Backoff(delayExpression = "${app.kafka.retry.delay-ms:1000}", multiplier = 2.0),
            topicSuffixingStrategy = TopicSuffixingStrategy.SUFFIX_WITH_INDEX_VALUE,
            exclude = MalformedPaymentEventException.class
    )
    @KafkaListener(
            topics = "${app.kafka.topics.payment-events}",
            groupId = "${spring.kafka.consumer.group-id}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consumePaymentEvent(ConsumerRecord<String, String> record) {
        log.debug("Consumed payment event: partition={}, offset={}, key={}",
                record.partition(), record.offset(), record.key());

        try {
            PaymentEvent event = eventReader.read(record.value());
            ProcessingOutcome outcome = processor.process(event);
            count(outcome.name().toLowerCase(Locale.ROOT));

        } catch (MalformedPaymentEventException e) {
            log.warn("Discarding malformed payment event at offset {}: {}", record.offset(), e.getMessage());
            count("malformed");
            throw e;

        } catch (RuntimeException e) {
            log.warn("Payment event {} failed, will be redelivered: {}", record.key(), e.getMessage());
            count("retry");
            throw e;
        }
    }

    @DltHandler
    public void handleDlt(ConsumerRecord<String, String> record,
                          @Header(value = KafkaHeaders.EXCEPTION_MESSAGE, required = false) String error) {
        count("dead_lettered");
        log.error("Payment event {} sent to DLT. Manual intervention required: {} (payload: {})",
                record.key(), error, record.value());
    }

    private void count(String result) {
        Counter.builder("kafka.payment.events.consumed")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
