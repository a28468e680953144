package com.storefront.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Log of payment provider events keyed by the provider reference.
 *
 * The unique constraint on {@code reference} is what makes concurrent duplicate deliveries
 * safe: only one insert can win, everyone else reads the winner's row.
 * Rows are never deleted.
 */
@Entity
@Table(name = "payment_event_log", indexes = {
    @Index(name = "idx_event_log_reference", columnList = "reference", unique = true),
    @Index(name = "idx_event_log_status_created", columnList = "status,createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdempotencyRecordEntity {

    public static final int MAX_REFERENCE_LENGTH = 255;
    public static final int MAX_EVENT_TYPE_LENGTH = 100;

    @Id
    @Column(columnDefinition = "UUID")
    private UUID recordId;

    @Column(nullable = false, unique = true, length = MAX_REFERENCE_LENGTH)
    private String reference;

    @Column(nullable = false, length = 30)
    private String provider;

    @Column(nullable = false, length = MAX_EVENT_TYPE_LENGTH)
    private String eventType;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ProcessingStatus status;

    @Column(length = 1000)
    private String errorMessage;

    @Column(columnDefinition = "UUID")
    private UUID orderId;

    @Column(nullable = false)
    private Integer attempts;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Column
    private Instant processedAt;

    public enum ProcessingStatus {
        PROCESSING,
        PROCESSED,
        PROCESSED_REFUNDED,
        IGNORED,
        FAILED;

        private static final Set<ProcessingStatus> TERMINAL = EnumSet.of(PROCESSED, PROCESSED_REFUNDED, IGNORED);

        public boolean isTerminal() {
            return TERMINAL.contains(this);
        }
    }

    @PrePersist
    protected void onCreate() {
        if (recordId == null) {
            recordId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        if (status == null) {
            status = ProcessingStatus.PROCESSING;
        }
        if (attempts == null) {
            attempts = 1;
        }
    }
}
