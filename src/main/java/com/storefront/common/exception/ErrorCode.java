package com.storefront.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Error codes surfaced by the payment and stock APIs.
 *
 * Each code carries the HTTP status it maps to and a default message.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Invalid input value"),
    SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable"),

    // Payment events
    INVALID_PAYMENT_EVENT(HttpStatus.BAD_REQUEST, "Invalid payment event payload"),
    INVALID_SIGNATURE(HttpStatus.BAD_REQUEST, "Invalid webhook signature"),
    EVENT_IN_PROGRESS(HttpStatus.CONFLICT, "Payment event is already being processed"),

    // Orders
    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, "Order not found"),
    INVALID_ORDER_STATE(HttpStatus.CONFLICT, "Order is not in a state that allows this operation"),

    // Stock
    VARIANT_NOT_FOUND(HttpStatus.NOT_FOUND, "Variant not found"),
    INSUFFICIENT_STOCK(HttpStatus.CONFLICT, "Insufficient stock"),

    // Payment provider
    PAYMENT_PROVIDER_ERROR(HttpStatus.BAD_GATEWAY, "Payment provider request failed"),
    REFUND_FAILED(HttpStatus.BAD_GATEWAY, "Refund request failed");

    private final HttpStatus status;
    private final String message;
}
