package com.storefront.domain.service;

import com.storefront.common.exception.BusinessException;
import com.storefront.common.exception.ErrorCode;
import com.storefront.domain.model.SettlementResult;
import com.storefront.domain.model.StockShortage;
import com.storefront.infrastructure.persistence.entity.IdempotencyRecordEntity.ProcessingStatus;
import com.storefront.infrastructure.persistence.entity.OrderEntity;
import com.storefront.infrastructure.persistence.entity.StockMovementEntity.MovementType;
import com.storefront.infrastructure.persistence.entity.VariantEntity;
import com.storefront.infrastructure.persistence.repository.DiscountCodeRepository;
import com.storefront.infrastructure.persistence.repository.OrderItemRepository;
import com.storefront.infrastructure.persistence.repository.OrderRepository;
import com.storefront.infrastructure.persistence.repository.VariantRepository;
import com.storefront.testutil.TestData;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StockSettlementServiceTest {

    private static final String REFERENCE = "ref-001";

    @Mock private OrderRepository orderRepository;
    @Mock private OrderItemRepository orderItemRepository;
    @Mock private VariantRepository variantRepository;
    @Mock private DiscountCodeRepository discountCodeRepository;
    @Mock private StockLedgerService stockLedger;
    @Mock private IdempotencyService idempotencyService;

    private MeterRegistry meterRegistry;
    private StockSettlementService settlementService;

    private OrderEntity order;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();

        settlementService = new StockSettlementService(
                orderRepository,
                orderItemRepository,
                variantRepository,
                discountCodeRepository,
                stockLedger,
                idempotencyService,
                meterRegistry
        );

        order = TestData.order("ORD-1001", REFERENCE);
        order.setOrderId(UUID.randomUUID());
    }

    @Test
    void settle_allItemsInStock_deductsAndMarksPaid() {
        VariantEntity shirt = TestData.variant("TSHIRT-M", 10);
        VariantEntity mug = TestData.variant("MUG-01", 4);

        when(orderRepository.lockByPaymentReference(REFERENCE)).thenReturn(Optional.of(order));
        when(orderItemRepository.findByOrderId(order.getOrderId())).thenReturn(List.of(
                TestData.item(order.getOrderId(), shirt.getVariantId(), 2),
                TestData.item(order.getOrderId(), mug.getVariantId(), 1)));
        when(variantRepository.findAllByIdForUpdate(anyCollection())).thenReturn(List.of(shirt, mug));

        SettlementResult result = settlementService.settle(REFERENCE);

        assertEquals(SettlementResult.Status.PAID, result.status());
        assertEquals(OrderEntity.PaymentStatus.PAID, order.getPaymentStatus());
        assertEquals(OrderEntity.OrderStatus.PROCESSING, order.getStatus());
        assertNotNull(order.getPaidAt());

        verify(stockLedger).adjust(shirt.getVariantId(), -2, MovementType.SALE,
                "Order ORD-1001 payment confirmed", null, order.getOrderId());
        verify(stockLedger).adjust(mug.getVariantId(), -1, MovementType.SALE,
                "Order ORD-1001 payment confirmed", null, order.getOrderId());
        verify(idempotencyService).complete(REFERENCE, ProcessingStatus.PROCESSED, order.getOrderId());
        verify(orderRepository).save(order);
    }

    @Test
    void settle_sameVariantOnTwoLines_deductedOnceWithTotal() {
        VariantEntity shirt = TestData.variant("TSHIRT-M", 10);

        when(orderRepository.lockByPaymentReference(REFERENCE)).thenReturn(Optional.of(order));
        when(orderItemRepository.findByOrderId(order.getOrderId())).thenReturn(List.of(
                TestData.item(order.getOrderId(), shirt.getVariantId(), 2),
                TestData.item(order.getOrderId(), shirt.getVariantId(), 3)));
        when(variantRepository.findAllByIdForUpdate(anyCollection())).thenReturn(List.of(shirt));

        settlementService.settle(REFERENCE);

        verify(stockLedger).adjust(eq(shirt.getVariantId()), eq(-5), eq(MovementType.SALE), anyString(), isNull(),
                eq(order.getOrderId()));
        verifyNoMoreInteractions(stockLedger);
    }

    @Test
    void settle_combinedQuantityExceedsStock_refundRequired() {
        VariantEntity shirt = TestData.variant("TSHIRT-M", 4);

        when(orderRepository.lockByPaymentReference(REFERENCE)).thenReturn(Optional.of(order));
        when(orderItemRepository.findByOrderId(order.getOrderId())).thenReturn(List.of(
                TestData.item(order.getOrderId(), shirt.getVariantId(), 2),
                TestData.item(order.getOrderId(), shirt.getVariantId(), 3)));
        when(variantRepository.findAllByIdForUpdate(anyCollection())).thenReturn(List.of(shirt));

        SettlementResult result = settlementService.settle(REFERENCE);

        assertEquals(SettlementResult.Status.REFUND_REQUIRED, result.status());
        assertEquals(List.of(new StockShortage(shirt.getVariantId(), "TSHIRT-M", "Product TSHIRT-M", 4, 5)),
                result.shortages());
        verifyNoInteractions(stockLedger);
    }

    @Test
    void settle_insufficientStock_cancelsForRefundAndReleasesCoupon() {
        VariantEntity shirt = TestData.variant("TSHIRT-M", 3);
        VariantEntity mug = TestData.variant("MUG-01", 10);
        order.setCouponCode("WELCOME10");

        when(orderRepository.lockByPaymentReference(REFERENCE)).thenReturn(Optional.of(order));
        when(orderItemRepository.findByOrderId(order.getOrderId())).thenReturn(List.of(
                TestData.item(order.getOrderId(), shirt.getVariantId(), 5),
                TestData.item(order.getOrderId(), mug.getVariantId(), 1)));
        when(variantRepository.findAllByIdForUpdate(anyCollection())).thenReturn(List.of(shirt, mug));
        when(discountCodeRepository.releaseUsage("WELCOME10")).thenReturn(1);

        SettlementResult result = settlementService.settle(REFERENCE);

        assertEquals(SettlementResult.Status.REFUND_REQUIRED, result.status());
        assertEquals(OrderEntity.OrderStatus.CANCELLED, order.getStatus());
        assertEquals(OrderEntity.PaymentStatus.REFUND_PENDING, order.getPaymentStatus());
        assertEquals("Auto-cancelled: Insufficient stock. TSHIRT-M: needed 5, had 3", order.getNotes());
        assertEquals(1, result.shortages().size());
        assertEquals(SettlementResult.RefundReason.INSUFFICIENT_STOCK, result.refundReason());
        assertEquals(REFERENCE, result.reference());

        // nothing deducted, not even the variant that had enough
        verifyNoInteractions(stockLedger);
        verify(discountCodeRepository).releaseUsage("WELCOME10");
        verify(idempotencyService).complete(REFERENCE, ProcessingStatus.PROCESSED_REFUNDED, order.getOrderId());
    }

    @Test
    void settle_shortageNoteAppendedToExistingNotes() {
        VariantEntity shirt = TestData.variant("TSHIRT-M", 0);
        order.setNotes("Gift wrap please");

        when(orderRepository.lockByPaymentReference(REFERENCE)).thenReturn(Optional.of(order));
        when(orderItemRepository.findByOrderId(order.getOrderId()))
                .thenReturn(List.of(TestData.item(order.getOrderId(), shirt.getVariantId(), 1)));
        when(variantRepository.findAllByIdForUpdate(anyCollection())).thenReturn(List.of(shirt));

        settlementService.settle(REFERENCE);

        assertEquals("Gift wrap please | Auto-cancelled: Insufficient stock. TSHIRT-M: needed 1, had 0",
                order.getNotes());
        verifyNoInteractions(discountCodeRepository);
    }

    @Test
    void settle_orderAlreadyPaid_noChanges() {
        order.markPaid(Instant.now());
        when(orderRepository.lockByPaymentReference(REFERENCE)).thenReturn(Optional.of(order));

        SettlementResult result = settlementService.settle(REFERENCE);

        assertEquals(SettlementResult.Status.ALREADY_SETTLED, result.status());
        verifyNoInteractions(orderItemRepository, variantRepository, stockLedger);
        verify(orderRepository, never()).save(any());
        verify(idempotencyService).complete(REFERENCE, ProcessingStatus.PROCESSED, order.getOrderId());
    }

    @Test
    void settle_orderAlreadyRefunded_noChanges() {
        order.markRefundPending("Auto-cancelled: Insufficient stock. TSHIRT-M: needed 5, had 3");
        order.markRefunded();
        when(orderRepository.lockByPaymentReference(REFERENCE)).thenReturn(Optional.of(order));

        SettlementResult result = settlementService.settle(REFERENCE);

        assertEquals(SettlementResult.Status.ALREADY_SETTLED, result.status());
        assertEquals(OrderEntity.PaymentStatus.REFUNDED, order.getPaymentStatus());
        verifyNoInteractions(stockLedger, discountCodeRepository);
        verify(idempotencyService).complete(REFERENCE, ProcessingStatus.PROCESSED_REFUNDED, order.getOrderId());
    }

    @Test
    void settle_orderCancelledBeforePaymentCleared_refundedWithoutStockCheck() {
        order.markPaymentFailed("Payment abandoned (verified with provider)");
        order.setCouponCode("WELCOME10");
        when(orderRepository.lockByPaymentReference(REFERENCE)).thenReturn(Optional.of(order));

        SettlementResult result = settlementService.settle(REFERENCE);

        assertEquals(SettlementResult.Status.REFUND_REQUIRED, result.status());
        assertEquals(SettlementResult.RefundReason.CANCELLED_BEFORE_PAYMENT, result.refundReason());
        assertTrue(result.shortages().isEmpty());
        assertEquals(OrderEntity.PaymentStatus.REFUND_PENDING, order.getPaymentStatus());
        assertTrue(order.getNotes().endsWith(StockSettlementService.PAYMENT_FAILED_NOTE));
        verifyNoInteractions(orderItemRepository, variantRepository, stockLedger, discountCodeRepository);
    }

    @Test
    void settle_unknownReference_throwsOrderNotFound() {
        when(orderRepository.lockByPaymentReference(REFERENCE)).thenReturn(Optional.empty());

        BusinessException thrown = assertThrows(BusinessException.class, () -> settlementService.settle(REFERENCE));

        assertEquals(ErrorCode.ORDER_NOT_FOUND, thrown.getErrorCode());
        verifyNoInteractions(idempotencyService, stockLedger);
    }

    @Test
    void settle_variantMissing_throwsAndDeductsNothing() {
        UUID missing = UUID.randomUUID();
        when(orderRepository.lockByPaymentReference(REFERENCE)).thenReturn(Optional.of(order));
        when(orderItemRepository.findByOrderId(order.getOrderId()))
                .thenReturn(List.of(TestData.item(order.getOrderId(), missing, 1)));
        when(variantRepository.findAllByIdForUpdate(anyCollection())).thenReturn(List.of());

        BusinessException thrown = assertThrows(BusinessException.class, () -> settlementService.settle(REFERENCE));

        assertEquals(ErrorCode.VARIANT_NOT_FOUND, thrown.getErrorCode());
        verifyNoInteractions(stockLedger);
        verify(idempotencyService, never()).complete(anyString(), any(), any());
    }

    @Test
    void settle_locksOrderBeforeVariants() {
        VariantEntity shirt = TestData.variant("TSHIRT-M", 10);
        when(orderRepository.lockByPaymentReference(REFERENCE)).thenReturn(Optional.of(order));
        when(orderItemRepository.findByOrderId(order.getOrderId()))
                .thenReturn(List.of(TestData.item(order.getOrderId(), shirt.getVariantId(), 1)));
        when(variantRepository.findAllByIdForUpdate(anyCollection())).thenReturn(List.of(shirt));

        settlementService.settle(REFERENCE);

        InOrder inOrder = inOrder(orderRepository, variantRepository, stockLedger);
        inOrder.verify(orderRepository).lockByPaymentReference(REFERENCE);
        inOrder.verify(variantRepository).findAllByIdForUpdate(anyCollection());
        inOrder.verify(stockLedger).adjust(any(), anyInt(), any(), anyString(), any(), any());
    }
}
