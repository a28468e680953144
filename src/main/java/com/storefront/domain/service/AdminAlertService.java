package com.storefront.domain.service;

import com.storefront.domain.model.PushMessage;
import com.storefront.domain.model.SettlementResult;
import com.storefront.domain.model.StockLevelChangedEvent;
import com.storefront.infrastructure.notification.SseSessionRegistry;
import com.storefront.infrastructure.persistence.entity.NotificationEntity;
import com.storefront.infrastructure.persistence.entity.UserEntity;
import com.storefront.infrastructure.persistence.repository.NotificationRepository;
import com.storefront.infrastructure.persistence.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/**
 * Escalations to every active administrator: a persisted notification plus a live push.
 *
 * Runs in its own transaction because it is called after the business transaction has
 * already committed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminAlertService {

    static final String REFUND_FAILED = "refund_failed";
    static final String REFUND_NOT_RECORDED = "refund_not_recorded";
    static final String LOW_STOCK = "admin_low_stock";
    static final String OUT_OF_STOCK = "admin_out_of_stock";

    private final UserRepository userRepository;
    private final NotificationRepository notificationRepository;
    private final SseSessionRegistry sseSessionRegistry;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int refundFailed(SettlementResult order, String error) {
        log.error("URGENT: automatic refund failed for order {} (reference {}). Manual refund required: {}",
                order.orderNumber(), order.reference(), error);

        return notifyAdmins(REFUND_FAILED, true,
                "URGENT: Refund Failed",
                "Automatic refund failed for reference " + order.reference()
                        + ". Amount needs manual refund via the payment provider dashboard. Error: " + error,
                "/admin/orders/" + order.orderNumber());
    }

    /**
     * The provider accepted the refund but the order could not be updated to REFUNDED.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int refundNotRecorded(SettlementResult order, String error) {
        log.error("URGENT: refund for order {} (reference {}) succeeded at the provider but was not recorded: {}",
                order.orderNumber(), order.reference(), error);

        return notifyAdmins(REFUND_NOT_RECORDED, true,
                "URGENT: Refund Not Recorded",
                "Refund for reference " + order.reference() + " was accepted by the payment provider, but order #"
                        + order.orderNumber() + " could not be marked refunded. Do not refund again. Error: " + error,
                "/admin/orders/" + order.orderNumber());
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int stockLevel(StockLevelChangedEvent event) {
        if (event.newStock() <= 0) {
            return notifyAdmins(OUT_OF_STOCK, true,
                    "OUT OF STOCK: " + event.productName(),
                    "SKU " + event.sku() + " is now out of stock!",
                    "/admin/inventory");
        }
        return notifyAdmins(LOW_STOCK, false,
                "Low Stock: " + event.productName(),
                "Only " + event.newStock() + " units left (SKU: " + event.sku() + ")",
                "/admin/inventory");
    }

    private int notifyAdmins(String type, boolean urgent, String title, String message, String link) {
        List<UserEntity> admins = userRepository.findByRoleInAndActiveTrue(
                EnumSet.of(UserEntity.Role.ADMIN, UserEntity.Role.SUPER_ADMIN));

        if (admins.isEmpty()) {
            log.warn("No active admins to notify about {}", type);
            return 0;
        }

        PushMessage push = new PushMessage(type, title, Map.of("message", message, "link", link));
        for (UserEntity admin : admins) {
            notificationRepository.save(NotificationEntity.builder()
                    .userId(admin.getUserId())
                    .type(type)
                    .title(title)
                    .message(message)
                    .link(link)
                    .urgent(urgent)
                    .build());
            sseSessionRegistry.push(admin.getUserId(), push);
        }

        log.info("Notified {} admins: {}", admins.size(), type);
        return admins.size();
    }
}
