package com.storefront.infrastructure.persistence.repository;

import com.storefront.infrastructure.persistence.entity.IdempotencyRecordEntity;
import com.storefront.infrastructure.persistence.entity.IdempotencyRecordEntity.ProcessingStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface IdempotencyRecordRepository extends JpaRepository<IdempotencyRecordEntity, UUID>,
        JpaSpecificationExecutor<IdempotencyRecordEntity> {

    Optional<IdempotencyRecordEntity> findByReference(String reference);

    /**
     * Take over a record left FAILED, or left PROCESSING by a worker that went away.
     *
     * @return 1 if this caller now owns the record
     */
    @Modifying
    @Query("UPDATE IdempotencyRecordEntity r SET r.status = :processing, r.attempts = r.attempts + 1, " +
           "r.errorMessage = NULL, r.payload = :payload, r.updatedAt = :now " +
           "WHERE r.reference = :reference " +
           "AND (r.status = :failed OR (r.status = :processing AND r.updatedAt < :staleBefore))")
    int reclaim(@Param("reference") String reference,
                @Param("payload") String payload,
                @Param("processing") ProcessingStatus processing,
                @Param("failed") ProcessingStatus failed,
                @Param("staleBefore") Instant staleBefore,
                @Param("now") Instant now);

    @Modifying
    @Query("UPDATE IdempotencyRecordEntity r SET r.status = :status, r.orderId = :orderId, " +
           "r.errorMessage = NULL, r.processedAt = :now, r.updatedAt = :now " +
           "WHERE r.reference = :reference AND (r.status = :processing OR r.status = :status)")
    int complete(@Param("reference") String reference,
                 @Param("status") ProcessingStatus status,
                 @Param("orderId") UUID orderId,
                 @Param("processing") ProcessingStatus processing,
                 @Param("now") Instant now);

    @Modifying
    @Query("UPDATE IdempotencyRecordEntity r SET r.status = :failed, r.errorMessage = :errorMessage, " +
           "r.updatedAt = :now " +
           "WHERE r.reference = :reference AND r.status IN :open")
    int fail(@Param("reference") String reference,
             @Param("errorMessage") String errorMessage,
             @Param("failed") ProcessingStatus failed,
             @Param("open") Collection<ProcessingStatus> open,
             @Param("now") Instant now);
}
