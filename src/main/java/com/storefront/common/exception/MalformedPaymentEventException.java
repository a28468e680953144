package com.storefront.common.exception;

/**
 * A structurally invalid provider event. Never retried.
 */
public class MalformedPaymentEventException extends BusinessException {

    public MalformedPaymentEventException(String message) {
        super(ErrorCode.INVALID_PAYMENT_EVENT, message);
    }

    public MalformedPaymentEventException(String message, Throwable cause) {
        super(ErrorCode.INVALID_PAYMENT_EVENT, message, cause);
    }
}
