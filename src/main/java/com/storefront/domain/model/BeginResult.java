package com.storefront.domain.model;

import com.storefront.infrastructure.persistence.entity.IdempotencyRecordEntity;

/**
 * Outcome of claiming a provider event reference.
 */
public record BeginResult(Outcome outcome, IdempotencyRecordEntity record) {

    public enum Outcome {
        /** The caller owns the event and must finish it with complete or fail. */
        STARTED,
        /** A terminal record exists; nothing to do. */
        ALREADY_PROCESSED,
        /** Another worker owns the event. */
        IN_PROGRESS
    }

    public static BeginResult started(IdempotencyRecordEntity record) {
        return new BeginResult(Outcome.STARTED, record);
    }

    public static BeginResult alreadyProcessed(IdempotencyRecordEntity record) {
        return new BeginResult(Outcome.ALREADY_PROCESSED, record);
    }

    public static BeginResult inProgress(IdempotencyRecordEntity record) {
        return new BeginResult(Outcome.IN_PROGRESS, record);
    }
}
