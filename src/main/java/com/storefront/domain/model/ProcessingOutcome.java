package com.storefront.domain.model;

/**
 * What processing a provider event did.
 */
public enum ProcessingOutcome {
    /** Stock deducted and the order is now paid. */
    PAID,
    /** Stock could not cover the order; it was cancelled and a refund was started. */
    REFUND_REQUIRED,
    /** The event reference was already processed. */
    DUPLICATE,
    /** The order had already been settled by an earlier event. */
    ALREADY_SETTLED,
    /** Event type with no business effect here. */
    IGNORED
}
