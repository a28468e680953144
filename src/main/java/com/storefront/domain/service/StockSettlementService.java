package com.storefront.domain.service;

import com.storefront.common.exception.BusinessException;
import com.storefront.common.exception.ErrorCode;
import com.storefront.domain.model.SettlementResult;
import com.storefront.domain.model.StockShortage;
import com.storefront.infrastructure.persistence.entity.IdempotencyRecordEntity.ProcessingStatus;
import com.storefront.infrastructure.persistence.entity.OrderEntity;
import com.storefront.infrastructure.persistence.entity.OrderItemEntity;
import com.storefront.infrastructure.persistence.entity.StockMovementEntity.MovementType;
import com.storefront.infrastructure.persistence.entity.VariantEntity;
import com.storefront.infrastructure.persistence.repository.DiscountCodeRepository;
import com.storefront.infrastructure.persistence.repository.OrderItemRepository;
import com.storefront.infrastructure.persistence.repository.OrderRepository;
import com.storefront.infrastructure.persistence.repository.VariantRepository;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Settles an order against a confirmed payment in one database transaction.
 *
 * Settlement Flow:
 * 1. Lock the order row by payment reference
 * 2. Short-circuit if an earlier event already settled it
 * 3. Lock every variant on the order (ascending id) and check stock once for all items
 * 4a. Any shortage: cancel the order for refund, release the coupon, deduct nothing
 * 4b. Otherwise: deduct every item through the stock ledger and mark the order paid
 * 5. Complete the event log record in the same transaction
 *
 * The refund itself and all notifications happen after commit, in the caller.
 *
 * Failure Handling:
 * - Lock timeout / deadlock / optimistic lock failure: retried by the stockSettlement retry
 * - Anything else: rolled back and rethrown; the caller marks the event FAILED
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StockSettlementService {

    static final String SALE_REASON = "Order %s payment confirmed";
    static final String SHORTAGE_NOTE = "Auto-cancelled: Insufficient stock. ";
    static final String PAYMENT_FAILED_NOTE = "Auto-cancelled: order cancelled before payment cleared";

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final VariantRepository variantRepository;
    private final DiscountCodeRepository discountCodeRepository;
    private final StockLedgerService stockLedger;
    private final IdempotencyService idempotencyService;
    private final MeterRegistry meterRegistry;

    @Transactional
    @Retry(name = "stockSettlement")
    public SettlementResult settle(String reference) {
        Timer.Sample sample = Timer.start(meterRegistry);

        OrderEntity order = orderRepository.lockByPaymentReference(reference)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND,
                        "Order not found for reference: " + reference));

        SettlementResult result = settleLocked(order, reference);

        sample.stop(Timer.builder("payment.settlement.latency")
                .tag("result", result.status().name().toLowerCase(Locale.ROOT))
                .register(meterRegistry));

        return result;
    }

    private SettlementResult settleLocked(OrderEntity order, String reference) {
        OrderEntity.PaymentStatus paymentStatus = order.getPaymentStatus();

        if (paymentStatus == OrderEntity.PaymentStatus.PAID) {
            log.info("Order {} already paid, nothing to settle", order.getOrderNumber());
            idempotencyService.complete(reference, ProcessingStatus.PROCESSED, order.getOrderId());
            return SettlementResult.alreadySettled(order);
        }

        if (paymentStatus.isCompensation()) {
            log.info("Order {} already in {}, nothing to settle", order.getOrderNumber(), paymentStatus);
            idempotencyService.complete(reference, ProcessingStatus.PROCESSED_REFUNDED, order.getOrderId());
            return SettlementResult.alreadySettled(order);
        }

        if (paymentStatus == OrderEntity.PaymentStatus.FAILED) {
            log.warn("Payment {} cleared for order {} that was already cancelled; refunding",
                    reference, order.getOrderNumber());
            order.markRefundPending(PAYMENT_FAILED_NOTE);
            orderRepository.save(order);
            idempotencyService.complete(reference, ProcessingStatus.PROCESSED_REFUNDED, order.getOrderId());
            count("cancelled_before_payment");
            return SettlementResult.cancelledBeforePayment(order);
        }

        SortedMap<UUID, Integer> requested = aggregate(orderItemRepository.findByOrderId(order.getOrderId()));
        List<StockShortage> shortages = findShortages(requested);

        if (!shortages.isEmpty()) {
            String detail = shortages.stream().map(StockShortage::describe).collect(Collectors.joining("; "));
            log.warn("Stock check failed for order {}: {}", order.getOrderNumber(), detail);

            order.markRefundPending(SHORTAGE_NOTE + detail);
            orderRepository.save(order);
            releaseCoupon(order);
            idempotencyService.complete(reference, ProcessingStatus.PROCESSED_REFUNDED, order.getOrderId());
            count("insufficient_stock");
            return SettlementResult.refundRequired(order, shortages);
        }

        String reason = String.format(SALE_REASON, order.getOrderNumber());
        requested.forEach((variantId, quantity) ->
                stockLedger.adjust(variantId, -quantity, MovementType.SALE, reason, null, order.getOrderId()));

        order.markPaid(Instant.now());
        orderRepository.save(order);
        idempotencyService.complete(reference, ProcessingStatus.PROCESSED, order.getOrderId());
        count("paid");

        log.info("Order {} paid: {} variant(s) deducted (reference: {})",
                order.getOrderNumber(), requested.size(), reference);

        return SettlementResult.paid(order);
    }

    /**
     * Total requested quantity per variant, ordered by variant id.
     */
    private SortedMap<UUID, Integer> aggregate(List<OrderItemEntity> items) {
        SortedMap<UUID, Integer> requested = new TreeMap<>();
        for (OrderItemEntity item : items) {
            requested.merge(item.getVariantId(), item.getQuantity(), Integer::sum);
        }
        return requested;
    }

    private List<StockShortage> findShortages(SortedMap<UUID, Integer> requested) {
        if (requested.isEmpty()) {
            return List.of();
        }

        Map<UUID, VariantEntity> variants = variantRepository.findAllByIdForUpdate(requested.keySet()).stream()
                .collect(Collectors.toMap(VariantEntity::getVariantId, Function.identity()));

        List<StockShortage> shortages = new ArrayList<>();
        requested.forEach((variantId, quantity) -> {
            VariantEntity variant = variants.get(variantId);
            if (variant == null) {
                throw new BusinessException(ErrorCode.VARIANT_NOT_FOUND, "Variant not found: " + variantId);
            }
            if (variant.getStock() < quantity) {
                shortages.add(new StockShortage(variantId, variant.getSku(), variant.getProductName(),
                        variant.getStock(), quantity));
            }
        });
        return shortages;
    }

    private void releaseCoupon(OrderEntity order) {
        String code = order.getCouponCode();
        if (code == null || code.isBlank()) {
            return;
        }
        if (discountCodeRepository.releaseUsage(code) == 0) {
            log.warn("Coupon {} on order {} had no usage to release", code, order.getOrderNumber());
        } else {
            log.info("Released coupon {} usage for cancelled order {}", code, order.getOrderNumber());
        }
    }

    private void count(String result) {
        Counter.builder("payment.settlement")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
