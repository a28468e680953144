package com.storefront.domain.model;

/**
 * Result of checking one pending order's payment with the provider.
 *
 * @param outcome processing outcome when the payment had succeeded, otherwise null
 */
public record VerificationResult(String orderNumber, String reference, String providerStatus,
                                 Action action, ProcessingOutcome outcome) {

    public enum Action {
        /** Payment succeeded and went through the processor. */
        PROCESSED,
        /** Provider reports the payment failed or abandoned; order cancelled. */
        CANCELLED,
        /** Still in flight at the provider, or the order moved on meanwhile. */
        UNCHANGED
    }
}
