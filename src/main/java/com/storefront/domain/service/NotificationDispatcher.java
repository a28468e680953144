package com.storefront.domain.service;

import com.storefront.domain.model.EmailMessage;
import com.storefront.domain.model.PushMessage;
import com.storefront.domain.model.SettlementResult;
import com.storefront.domain.model.StockShortage;
import com.storefront.infrastructure.notification.EmailQueue;
import com.storefront.infrastructure.notification.SseSessionRegistry;
import com.storefront.infrastructure.persistence.entity.NotificationEntity;
import com.storefront.infrastructure.persistence.entity.OrderItemEntity;
import com.storefront.infrastructure.persistence.entity.VariantEntity;
import com.storefront.infrastructure.persistence.repository.NotificationRepository;
import com.storefront.infrastructure.persistence.repository.OrderItemRepository;
import com.storefront.infrastructure.persistence.repository.VariantRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Customer-facing side effects of a settled payment.
 *
 * Runs on the notification executor after the settlement committed. Every sink (push,
 * in-app notification, email) is attempted on its own; a failing sink is logged and
 * counted and never affects the others or the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationDispatcher {

    private final SseSessionRegistry sseSessionRegistry;
    private final EmailQueue emailQueue;
    private final NotificationRepository notificationRepository;
    private final OrderItemRepository orderItemRepository;
    private final VariantRepository variantRepository;
    private final FeatureFlagService featureFlags;
    private final MeterRegistry meterRegistry;

    @Async("notificationExecutor")
    public void paymentConfirmed(SettlementResult order) {
        if (order.userId() != null) {
            sink("push", order, () -> sseSessionRegistry.push(order.userId(), new PushMessage(
                    "order_payment_confirmed",
                    "Payment received for Order #" + order.orderNumber(),
                    Map.of("orderNumber", order.orderNumber(),
                            "status", "PROCESSING",
                            "paymentStatus", "PAID"))));
        }

        sink("email", order, () -> {
            if (!featureFlags.isEnabled(FeatureFlagService.ORDER_CONFIRMATION_EMAIL)) {
                log.info("Order confirmation emails disabled, skipping order {}", order.orderNumber());
                return;
            }
            Map<String, Object> variables = new HashMap<>();
            variables.put("order_number", order.orderNumber());
            variables.put("customer_name", customerName(order.customerEmail()));
            variables.put("total", order.total());
            variables.put("items", orderLines(order.orderId()));
            variables.put("date", LocalDate.now().toString());

            emailQueue.enqueue(new EmailMessage(
                    "order_confirmation",
                    order.customerEmail(),
                    "Order Confirmed #" + order.orderNumber(),
                    "orderConfirmation",
                    variables));
            log.info("Queued confirmation email for order {}", order.orderNumber());
        });
    }

    @Async("notificationExecutor")
    public void orderCancelledForStock(SettlementResult order) {
        String message = "We're sorry, Order #" + order.orderNumber() + " has been cancelled and refunded "
                + "because one or more items sold out while you were checking out.";
        notifyRefund(order, "order_cancelled", "Order Cancelled - Item Out of Stock", message);

        sink("email", order, () -> {
            Map<String, Object> variables = new HashMap<>();
            variables.put("order_number", order.orderNumber());
            variables.put("customer_name", customerName(order.customerEmail()));
            variables.put("items", order.shortages().stream()
                    .map(NotificationDispatcher::shortageLine)
                    .collect(Collectors.toList()));

            emailQueue.enqueue(new EmailMessage(
                    "order_cancelled_stock",
                    order.customerEmail(),
                    "Order #" + order.orderNumber() + " Cancelled - Item Out of Stock",
                    "orderCancelledStock",
                    variables));
        });
    }

    /**
     * The payment cleared after the order had already been cancelled as unpaid, so the money went back.
     */
    @Async("notificationExecutor")
    public void paymentRefundedAfterCancellation(SettlementResult order) {
        String message = "Your payment for Order #" + order.orderNumber() + " arrived after the order was "
                + "cancelled, so it has been refunded in full.";
        notifyRefund(order, "order_payment_refunded", "Payment Refunded", message);

        sink("email", order, () -> {
            Map<String, Object> variables = new HashMap<>();
            variables.put("order_number", order.orderNumber());
            variables.put("customer_name", customerName(order.customerEmail()));
            variables.put("total", order.total());

            emailQueue.enqueue(new EmailMessage(
                    "order_payment_refunded",
                    order.customerEmail(),
                    "Payment Refunded for Order #" + order.orderNumber(),
                    "orderPaymentRefunded",
                    variables));
        });
    }

    private void notifyRefund(SettlementResult order, String type, String title, String message) {
        if (order.userId() == null) {
            return;
        }
        sink("in_app", order, () -> notificationRepository.save(NotificationEntity.builder()
                .userId(order.userId())
                .type(type)
                .title(title)
                .message(message)
                .link("/account/orders/" + order.orderNumber())
                .build()));

        sink("push", order, () -> sseSessionRegistry.push(order.userId(), new PushMessage(
                type,
                message,
                Map.of("orderNumber", order.orderNumber(),
                        "status", "CANCELLED",
                        "paymentStatus", "REFUNDED"))));
    }

    private void sink(String sink, SettlementResult order, Runnable action) {
        try {
            action.run();
            count(sink, "success");
        } catch (RuntimeException e) {
            log.error("Failed {} notification for order {}: {}", sink, order.orderNumber(), e.getMessage(), e);
            count(sink, "failure");
        }
    }

    private List<Map<String, Object>> orderLines(UUID orderId) {
        List<OrderItemEntity> items = orderItemRepository.findByOrderId(orderId);
        Map<UUID, VariantEntity> variants = variantRepository
                .findAllById(items.stream().map(OrderItemEntity::getVariantId).distinct().toList())
                .stream()
                .collect(Collectors.toMap(VariantEntity::getVariantId, Function.identity()));

        return items.stream().map(item -> {
            VariantEntity variant = variants.get(item.getVariantId());
            Map<String, Object> line = new HashMap<>();
            line.put("name", variant == null ? item.getVariantId().toString() : variant.getProductName());
            line.put("quantity", item.getQuantity());
            line.put("price", item.getUnitPrice());
            return line;
        }).collect(Collectors.toList());
    }

    private static Map<String, Object> shortageLine(StockShortage shortage) {
        return Map.of(
                "sku", shortage.sku(),
                "available", shortage.available(),
                "requested", shortage.requested());
    }

    private static String customerName(String email) {
        int at = email == null ? -1 : email.indexOf('@');
        return at > 0 ? email.substring(0, at) : email;
    }

    private void count(String sink, String result) {
        Counter.builder("notification.dispatch")
                .tag("sink", sink)
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
