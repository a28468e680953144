package com.storefront.common.exception;

/**
 * Another worker currently owns the event. Retryable: redelivery will find it terminal or reclaimable.
 */
public class EventInProgressException extends BusinessException {

    public EventInProgressException(String reference) {
        super(ErrorCode.EVENT_IN_PROGRESS, "Payment event " + reference + " is already being processed");
    }
}
