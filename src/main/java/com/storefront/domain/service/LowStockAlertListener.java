package com.storefront.domain.service;

import com.storefront.domain.model.StockLevelChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Alerts admins when a committed stock change crosses into low stock or out of stock.
 * Changes that stay on the same side of the threshold are not reported again.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LowStockAlertListener {

    private final AdminAlertService adminAlertService;
    private final StockLedgerService stockLedger;

    @Async("notificationExecutor")
    @TransactionalEventListener
    public void onStockLevelChanged(StockLevelChangedEvent event) {
        if (!crossedThreshold(event, stockLedger.getLowStockThreshold())) {
            return;
        }
        try {
            adminAlertService.stockLevel(event);
        } catch (RuntimeException e) {
            log.error("Failed to alert admins about stock level of {}: {}", event.sku(), e.getMessage(), e);
        }
    }

    static boolean crossedThreshold(StockLevelChangedEvent event, int threshold) {
        if (event.newStock() <= 0) {
            return event.previousStock() > 0;
        }
        return event.newStock() <= threshold && event.previousStock() > threshold;
    }
}
