package com.storefront.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Entity representing a customer order.
 *
 * Created at checkout. This service only moves {@code status}, {@code paymentStatus},
 * {@code paidAt} and appends to {@code notes}; everything else is owned by checkout.
 * The notes column is the operator-facing audit trail for compensation events.
 */
@Entity
@Table(name = "orders", indexes = {
    @Index(name = "idx_orders_payment_reference", columnList = "paymentReference", unique = true),
    @Index(name = "idx_orders_status_created", columnList = "status,paymentStatus,createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderEntity {

    static final String NOTE_SEPARATOR = " | ";

    @Id
    @Column(columnDefinition = "UUID")
    private UUID orderId;

    @Column(nullable = false, unique = true, length = 50)
    private String orderNumber;

    @Column(unique = true, length = 255)
    private String paymentReference;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OrderStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal total;

    @Column(length = 50)
    private String couponCode;

    @Column(nullable = false, length = 255)
    private String customerEmail;

    @Column(columnDefinition = "UUID")
    private UUID userId;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column
    private Instant paidAt;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    public enum OrderStatus {
        PENDING,
        PROCESSING,
        CANCELLED
    }

    public enum PaymentStatus {
        PENDING,
        PAID,
        REFUND_PENDING,
        REFUNDED,
        REFUND_FAILED,
        FAILED;

        public boolean isCompensation() {
            return this == REFUND_PENDING || this == REFUNDED || this == REFUND_FAILED;
        }
    }

    @PrePersist
    protected void onCreate() {
        if (orderId == null) {
            orderId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        if (status == null) {
            status = OrderStatus.PENDING;
        }
        if (paymentStatus == null) {
            paymentStatus = PaymentStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Append an entry to the audit trail. Existing entries are never rewritten.
     */
    public void appendNote(String note) {
        if (note == null || note.isBlank()) {
            return;
        }
        this.notes = (notes == null || notes.isBlank()) ? note : notes + NOTE_SEPARATOR + note;
    }

    public void markPaid(Instant when) {
        this.status = OrderStatus.PROCESSING;
        this.paymentStatus = PaymentStatus.PAID;
        this.paidAt = when;
    }

    public void markRefundPending(String reason) {
        this.status = OrderStatus.CANCELLED;
        this.paymentStatus = PaymentStatus.REFUND_PENDING;
        appendNote(reason);
    }

    public void markRefunded() {
        this.paymentStatus = PaymentStatus.REFUNDED;
    }

    public void markRefundFailed(String error) {
        this.paymentStatus = PaymentStatus.REFUND_FAILED;
        appendNote("Refund failed: " + error);
    }

    public void markPaymentFailed(String reason) {
        this.status = OrderStatus.CANCELLED;
        this.paymentStatus = PaymentStatus.FAILED;
        appendNote(reason);
    }
}
