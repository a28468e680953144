package com.storefront.domain.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Provider event types this service knows about. Anything else maps to {@link #UNRECOGNIZED}.
 */
@Getter
@RequiredArgsConstructor
public enum PaymentEventType {
    CHARGE_SUCCESS("charge.success"),
    CHARGE_FAILED("charge.failed"),
    REFUND_PROCESSED("refund.processed"),
    REFUND_FAILED("refund.failed"),
    TRANSFER_SUCCESS("transfer.success"),
    UNRECOGNIZED("");

    private final String wireName;

    public static PaymentEventType from(String wireName) {
        if (wireName == null) {
            return UNRECOGNIZED;
        }
        for (PaymentEventType type : values()) {
            if (type != UNRECOGNIZED && type.wireName.equals(wireName)) {
                return type;
            }
        }
        return UNRECOGNIZED;
    }
}
