package com.storefront.infrastructure.persistence.repository;

import com.storefront.infrastructure.persistence.entity.OrderEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OrderRepository extends JpaRepository<OrderEntity, UUID> {

    Optional<OrderEntity> findByPaymentReference(String paymentReference);

    Optional<OrderEntity> findByOrderNumber(String orderNumber);

    /**
     * Find order with pessimistic write lock.
     *
     * Two deliveries of the same payment event that both got past the idempotency check
     * queue up here; the second one sees the first one's committed status.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM OrderEntity o WHERE o.paymentReference = :reference")
    Optional<OrderEntity> lockByPaymentReference(@Param("reference") String reference);

    @Query("SELECT o FROM OrderEntity o " +
           "WHERE o.status = :status AND o.paymentStatus = :paymentStatus " +
           "AND o.paymentReference IS NOT NULL " +
           "AND o.createdAt < :createdBefore AND o.createdAt > :createdAfter " +
           "ORDER BY o.createdAt ASC")
    List<OrderEntity> findAwaitingVerification(@Param("status") OrderEntity.OrderStatus status,
                                               @Param("paymentStatus") OrderEntity.PaymentStatus paymentStatus,
                                               @Param("createdBefore") Instant createdBefore,
                                               @Param("createdAfter") Instant createdAfter,
                                               Pageable pageable);
}
