package com.storefront.infrastructure.scheduler;

import com.storefront.domain.model.VerificationResult;
import com.storefront.domain.service.OrderService;
import com.storefront.domain.service.PaymentVerificationService;
import com.storefront.infrastructure.persistence.entity.OrderEntity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Recovers payments whose webhook never arrived.
 *
 * Checks PENDING orders that are old enough for the customer to have paid but younger
 * than the point where the unpaid-order cancellation takes over. Oldest first, bounded
 * batch. An order that cannot be verified is skipped until the next run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentVerificationJob {

    private final OrderService orderService;
    private final PaymentVerificationService verificationService;
    private final MeterRegistry meterRegistry;

    @Value("${app.verification.enabled:true}")
    private boolean enabled;

    @Value("${app.verification.min-age:PT5M}")
    private Duration minAge;

    @Value("${app.verification.max-age:PT30M}")
    private Duration maxAge;

    @Value("${app.verification.batch-size:50}")
    private int batchSize;

    @Scheduled(cron = "${app.verification.cron:0 */10 * * * *}")
    public void verifyPendingPayments() {
        if (!enabled) {
            return;
        }

        List<OrderEntity> pending = orderService.findAwaitingVerification(minAge, maxAge, batchSize);
        if (pending.isEmpty()) {
            return;
        }

        int processed = 0;
        int cancelled = 0;
        int failed = 0;

        for (OrderEntity order : pending) {
            try {
                VerificationResult result = verificationService.verify(order);
                switch (result.action()) {
                    case PROCESSED -> processed++;
                    case CANCELLED -> cancelled++;
                    case UNCHANGED -> { }
                }
                count(result.action().name().toLowerCase(Locale.ROOT));
            } catch (RuntimeException e) {
                failed++;
                count("error");
                log.warn("Could not verify payment for order {}: {}", order.getOrderNumber(), e.getMessage());
            }
        }

        log.info("Payment verification: checked {}, processed {}, cancelled {}, failed {}",
                pending.size(), processed, cancelled, failed);
    }

    private void count(String result) {
        Counter.builder("payment.verification")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
