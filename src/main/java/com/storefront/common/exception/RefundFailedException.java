package com.storefront.common.exception;

import lombok.Getter;

@Getter
public class RefundFailedException extends BusinessException {

    private final String reference;

    public RefundFailedException(String reference, String message) {
        super(ErrorCode.REFUND_FAILED, message);
        this.reference = reference;
    }

    public RefundFailedException(String reference, String message, Throwable cause) {
        super(ErrorCode.REFUND_FAILED, message, cause);
        this.reference = reference;
    }
}
