package com.storefront.domain.service;

import com.storefront.domain.model.BeginResult;
import com.storefront.infrastructure.persistence.entity.IdempotencyRecordEntity;
import com.storefront.infrastructure.persistence.entity.IdempotencyRecordEntity.ProcessingStatus;
import com.storefront.infrastructure.persistence.repository.IdempotencyRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.UUID;

/**
 * Idempotency store for provider events.
 *
 * Claiming an event is insert-first: the unique constraint on the reference decides which
 * delivery wins, so there is no check-then-act window between concurrent deliveries.
 *
 * Record lifecycle:
 * - PROCESSING: claimed by a worker
 * - PROCESSED / PROCESSED_REFUNDED / IGNORED: terminal, later deliveries are no-ops
 * - FAILED: the last attempt threw; the next delivery reclaims it
 *
 * A PROCESSING record that has not been touched for {@code app.idempotency.stale-after}
 * belongs to a worker that died and is reclaimed like a FAILED one.
 */
@Slf4j
@Service
public class IdempotencyService {

    public static final String PROVIDER = "paystack";

    private static final int MAX_ERROR_LENGTH = 1000;

    private final IdempotencyRecordRepository idempotencyRepository;
    private final TransactionTemplate newTransaction;
    private final Duration staleAfter;

    public IdempotencyService(IdempotencyRecordRepository idempotencyRepository,
                              PlatformTransactionManager transactionManager,
                              @Value("${app.idempotency.stale-after:PT5M}") Duration staleAfter) {
        this.idempotencyRepository = idempotencyRepository;
        this.newTransaction = new TransactionTemplate(transactionManager);
        this.newTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.staleAfter = staleAfter;
    }

    /**
     * Claim an event reference.
     *
     * The insert commits on its own before any business work starts, so the claim is
     * visible to every other worker immediately.
     */
    public BeginResult begin(String reference, String eventType, String payload) {
        try {
            IdempotencyRecordEntity created = newTransaction.execute(status ->
                    idempotencyRepository.saveAndFlush(IdempotencyRecordEntity.builder()
                            .reference(reference)
                            .provider(PROVIDER)
                            .eventType(truncate(eventType, IdempotencyRecordEntity.MAX_EVENT_TYPE_LENGTH))
                            .payload(payload)
                            .status(ProcessingStatus.PROCESSING)
                            .build()));

            log.debug("Claimed payment event {} ({})", reference, eventType);
            return BeginResult.started(created);

        } catch (DataIntegrityViolationException e) {
            log.debug("Payment event {} already logged, resolving existing record", reference);
            return resolveExisting(reference, payload, e);
        }
    }

    private BeginResult resolveExisting(String reference, String payload, DataIntegrityViolationException violation) {
        // no row means the insert failed for another reason than the unique reference
        IdempotencyRecordEntity existing = idempotencyRepository.findByReference(reference)
                .orElseThrow(() -> violation);

        ProcessingStatus status = existing.getStatus();
        if (status.isTerminal()) {
            log.info("Duplicate payment event {} (status: {})", reference, status);
            return BeginResult.alreadyProcessed(existing);
        }

        Instant now = Instant.now();
        Instant staleBefore = now.minus(staleAfter);
        boolean reclaimable = status == ProcessingStatus.FAILED
                || existing.getUpdatedAt().isBefore(staleBefore);
        if (!reclaimable) {
            log.info("Payment event {} is being processed by another worker", reference);
            return BeginResult.inProgress(existing);
        }

        Integer updated = newTransaction.execute(tx -> idempotencyRepository.reclaim(
                reference, payload, ProcessingStatus.PROCESSING, ProcessingStatus.FAILED, staleBefore, now));

        if (updated == null || updated == 0) {
            log.info("Lost reclaim race for payment event {}", reference);
            return BeginResult.inProgress(existing);
        }

        IdempotencyRecordEntity reclaimed = idempotencyRepository.findByReference(reference).orElse(existing);
        log.warn("Reclaimed payment event {} from status {} (attempt {})",
                reference, status, reclaimed.getAttempts());
        return BeginResult.started(reclaimed);
    }

    /**
     * Move a claimed record to a terminal status.
     *
     * Runs inside the caller's transaction so the terminal status commits together with the
     * business change. Completing twice with the same status is a no-op.
     *
     * @return false if the record was neither PROCESSING nor already in {@code status}
     */
    @Transactional
    public boolean complete(String reference, ProcessingStatus status, UUID orderId) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }

        int updated = idempotencyRepository.complete(
                reference, status, orderId, ProcessingStatus.PROCESSING, Instant.now());

        if (updated == 0) {
            log.warn("Could not complete payment event {} as {}: record is not in progress", reference, status);
            return false;
        }

        log.debug("Payment event {} completed as {}", reference, status);
        return true;
    }

    /**
     * Record a failed attempt. A terminal record is never overwritten.
     */
    @Transactional
    public void fail(String reference, String errorMessage) {
        String message = truncate(errorMessage == null ? "unknown error" : errorMessage, MAX_ERROR_LENGTH);

        int updated = idempotencyRepository.fail(reference, message, ProcessingStatus.FAILED,
                EnumSet.of(ProcessingStatus.PROCESSING, ProcessingStatus.FAILED), Instant.now());

        if (updated == 0) {
            log.warn("Payment event {} not marked FAILED: record missing or already terminal", reference);
        }
    }

    @Transactional(readOnly = true)
    public Page<IdempotencyRecordEntity> recent(ProcessingStatus status, String eventType, int page, int size) {
        Specification<IdempotencyRecordEntity> spec = Specification.where(null);
        if (status != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), status));
        }
        if (eventType != null && !eventType.isBlank()) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("eventType"), eventType));
        }
        return idempotencyRepository.findAll(spec,
                PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt")));
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
