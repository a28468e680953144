package com.storefront.testutil;

import com.storefront.domain.service.IdempotencyService;
import com.storefront.domain.service.NotificationDispatcher;
import com.storefront.domain.service.PaymentConfirmationProcessor;
import com.storefront.domain.service.RefundCompensator;
import com.storefront.domain.service.StockLedgerService;
import com.storefront.domain.service.StockSettlementService;
import com.storefront.infrastructure.persistence.repository.DiscountCodeRepository;
import com.storefront.infrastructure.persistence.repository.IdempotencyRecordRepository;
import com.storefront.infrastructure.persistence.repository.OrderItemRepository;
import com.storefront.infrastructure.persistence.repository.OrderRepository;
import com.storefront.infrastructure.persistence.repository.StockMovementRepository;
import com.storefront.infrastructure.persistence.repository.VariantRepository;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Base for tests that run the real services against the embedded database.
 *
 * Test-managed transactions are off: every service call commits on its own, exactly as in
 * production, so concurrent tests see each other's writes. Tables are emptied before each test.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({
        PersistenceTestConfig.class,
        IdempotencyService.class,
        StockLedgerService.class,
        StockSettlementService.class,
        PaymentConfirmationProcessor.class
})
public abstract class JpaIntegrationTest {

    @MockBean
    protected RefundCompensator refundCompensator;

    @MockBean
    protected NotificationDispatcher notificationDispatcher;

    @Autowired
    protected OrderRepository orderRepository;

    @Autowired
    protected OrderItemRepository orderItemRepository;

    @Autowired
    protected VariantRepository variantRepository;

    @Autowired
    protected StockMovementRepository movementRepository;

    @Autowired
    protected IdempotencyRecordRepository idempotencyRepository;

    @Autowired
    protected DiscountCodeRepository discountCodeRepository;

    @BeforeEach
    void cleanDatabase() {
        movementRepository.deleteAllInBatch();
        orderItemRepository.deleteAllInBatch();
        orderRepository.deleteAllInBatch();
        variantRepository.deleteAllInBatch();
        idempotencyRepository.deleteAllInBatch();
        discountCodeRepository.deleteAllInBatch();
    }
}
