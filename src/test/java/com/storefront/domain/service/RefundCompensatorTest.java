package com.storefront.domain.service;

import com.storefront.common.exception.BusinessException;
import com.storefront.common.exception.ErrorCode;
import com.storefront.common.exception.RefundFailedException;
import com.storefront.domain.model.SettlementResult;
import com.storefront.domain.model.StockShortage;
import com.storefront.infrastructure.client.PaymentProviderGateway;
import com.storefront.testutil.TestData;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RefundCompensatorTest {

    @Mock private PaymentProviderGateway paymentProvider;
    @Mock private OrderService orderService;
    @Mock private NotificationDispatcher notificationDispatcher;
    @Mock private AdminAlertService adminAlertService;

    private MeterRegistry meterRegistry;
    private RefundCompensator compensator;
    private SettlementResult order;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        compensator = new RefundCompensator(paymentProvider, orderService, notificationDispatcher,
                adminAlertService, meterRegistry);
        order = TestData.settlement(SettlementResult.Status.REFUND_REQUIRED,
                List.of(new StockShortage(UUID.randomUUID(), "TSHIRT-M", "T-Shirt", 3, 5)));
    }

    @Test
    void compensate_refundAccepted_orderRefundedAndCustomerNotified() {
        compensator.compensate(order);

        verify(paymentProvider).refund(order.reference());
        verify(orderService).markRefunded(order.orderId());
        verify(notificationDispatcher).orderCancelledForStock(order);
        verifyNoInteractions(adminAlertService);
        assertEquals(1.0, meterRegistry.counter("refund.compensation", "result", "refunded").count());
    }

    @Test
    void compensate_cancelledBeforePayment_refundNoticeInsteadOfStockNotice() {
        SettlementResult cancelled = TestData.cancelledBeforePayment();

        compensator.compensate(cancelled);

        verify(orderService).markRefunded(cancelled.orderId());
        verify(notificationDispatcher).paymentRefundedAfterCancellation(cancelled);
        verify(notificationDispatcher, never()).orderCancelledForStock(any());
    }

    @Test
    void compensate_refundRejected_orderMarkedFailedAndAdminsAlerted() {
        doThrow(new RefundFailedException(order.reference(), "Transaction has been fully reversed"))
                .when(paymentProvider).refund(order.reference());

        compensator.compensate(order);

        verify(orderService).markRefundFailed(order.orderId(), "Transaction has been fully reversed");
        verify(adminAlertService).refundFailed(order, "Transaction has been fully reversed");
        verify(orderService, never()).markRefunded(any());
        verifyNoInteractions(notificationDispatcher);
        assertEquals(1.0, meterRegistry.counter("refund.compensation", "result", "refund_failed").count());
    }

    @Test
    void compensate_failureNotRecordable_adminsStillAlerted() {
        doThrow(new RefundFailedException(order.reference(), "Payment provider returned HTTP 500"))
                .when(paymentProvider).refund(anyString());
        doThrow(new BusinessException(ErrorCode.INVALID_ORDER_STATE, "Order ORD-1001 is REFUNDED"))
                .when(orderService).markRefundFailed(any(), anyString());

        assertDoesNotThrow(() -> compensator.compensate(order));

        verify(adminAlertService).refundFailed(order, "Payment provider returned HTTP 500");
    }

    @Test
    void compensate_refundAcceptedButNotRecorded_adminsToldNotToRefundAgain() {
        doThrow(new IllegalStateException("connection reset")).when(orderService).markRefunded(order.orderId());

        compensator.compensate(order);

        verify(adminAlertService).refundNotRecorded(order, "connection reset");
        verifyNoInteractions(notificationDispatcher);
        assertEquals(1.0, meterRegistry.counter("refund.compensation", "result", "not_recorded").count());
    }

    @Test
    void compensate_alertFails_neverPropagates() {
        doThrow(new RefundFailedException(order.reference(), "timeout")).when(paymentProvider).refund(anyString());
        when(adminAlertService.refundFailed(any(), anyString())).thenThrow(new IllegalStateException("db down"));

        assertDoesNotThrow(() -> compensator.compensate(order));
    }
}
