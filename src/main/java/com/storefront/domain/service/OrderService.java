package com.storefront.domain.service;

import com.storefront.common.exception.BusinessException;
import com.storefront.common.exception.ErrorCode;
import com.storefront.infrastructure.persistence.entity.OrderEntity;
import com.storefront.infrastructure.persistence.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Order state changes made outside settlement: the refund outcome and payments the
 * provider reports as failed. Each call is its own short transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderService {

    private final OrderRepository orderRepository;

    @Transactional(readOnly = true)
    public OrderEntity getByOrderNumber(String orderNumber) {
        return orderRepository.findByOrderNumber(orderNumber)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND,
                        "Order not found: " + orderNumber));
    }

    @Transactional(readOnly = true)
    public List<OrderEntity> findAwaitingVerification(Duration minAge, Duration maxAge, int limit) {
        Instant now = Instant.now();
        return orderRepository.findAwaitingVerification(
                OrderEntity.OrderStatus.PENDING,
                OrderEntity.PaymentStatus.PENDING,
                now.minus(minAge),
                now.minus(maxAge),
                PageRequest.of(0, limit));
    }

    @Transactional
    public void markRefunded(UUID orderId) {
        OrderEntity order = load(orderId);
        requireRefundPending(order);
        order.markRefunded();
        orderRepository.save(order);
        log.info("Order {} refunded", order.getOrderNumber());
    }

    @Transactional
    public void markRefundFailed(UUID orderId, String error) {
        OrderEntity order = load(orderId);
        requireRefundPending(order);
        order.markRefundFailed(error);
        orderRepository.save(order);
        log.warn("Order {} refund failed: {}", order.getOrderNumber(), error);
    }

    /**
     * Cancel an order whose payment the provider reports as failed or abandoned.
     *
     * @return false if the order is no longer waiting for payment
     */
    @Transactional
    public boolean markPaymentFailed(String reference, String providerStatus) {
        OrderEntity order = orderRepository.lockByPaymentReference(reference)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND,
                        "Order not found for reference: " + reference));

        if (order.getPaymentStatus() != OrderEntity.PaymentStatus.PENDING) {
            log.info("Order {} no longer pending ({}), not marking payment failed",
                    order.getOrderNumber(), order.getPaymentStatus());
            return false;
        }

        order.markPaymentFailed("Payment " + providerStatus + " (verified with provider)");
        orderRepository.save(order);
        log.info("Order {} cancelled: payment {}", order.getOrderNumber(), providerStatus);
        return true;
    }

    private OrderEntity load(UUID orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND, "Order not found: " + orderId));
    }

    private static void requireRefundPending(OrderEntity order) {
        if (order.getPaymentStatus() != OrderEntity.PaymentStatus.REFUND_PENDING) {
            throw new BusinessException(ErrorCode.INVALID_ORDER_STATE,
                    "Order " + order.getOrderNumber() + " is " + order.getPaymentStatus() + ", expected REFUND_PENDING");
        }
    }
}
