package com.storefront.domain.service;

import com.storefront.common.exception.BusinessException;
import com.storefront.common.exception.ErrorCode;
import com.storefront.common.exception.InsufficientStockException;
import com.storefront.domain.model.LowStockVariant;
import com.storefront.domain.model.MovementFilter;
import com.storefront.domain.model.StockAdjustment;
import com.storefront.domain.model.StockLevelChangedEvent;
import com.storefront.domain.model.StockSummary;
import com.storefront.infrastructure.persistence.entity.StockMovementEntity;
import com.storefront.infrastructure.persistence.entity.StockMovementEntity.MovementType;
import com.storefront.infrastructure.persistence.entity.VariantEntity;
import com.storefront.infrastructure.persistence.repository.StockMovementRepository;
import com.storefront.infrastructure.persistence.repository.VariantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Stock ledger: the only writer of variant stock.
 *
 * Every change is a single conditional UPDATE followed by an appended movement row in the
 * same transaction. The conditional update is what keeps stock non-negative under
 * concurrent callers; there are no application-level locks here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StockLedgerService {

    private final VariantRepository variantRepository;
    private final StockMovementRepository movementRepository;
    private final ApplicationEventPublisher eventPublisher;

    @Value("${app.stock.low-stock-threshold:5}")
    private int lowStockThreshold;

    /**
     * Apply a signed stock change and record it.
     *
     * SALE needs a negative delta and an order; RESTOCK and RETURN need a positive delta.
     *
     * @param delta negative to take stock, positive to add it; never zero
     * @throws InsufficientStockException if a decrement would go below zero
     */
    @Transactional
    public StockAdjustment adjust(UUID variantId, int delta, MovementType type, String reason,
                                  UUID actorId, UUID orderId) {
        if (delta == 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Stock adjustment quantity must not be zero");
        }
        checkMovement(type, delta, orderId);

        VariantEntity variant = variantRepository.findById(variantId)
                .orElseThrow(() -> variantNotFound(variantId));

        Instant now = Instant.now();
        int updated = delta < 0
                ? variantRepository.decrementStock(variantId, -delta, now)
                : variantRepository.incrementStock(variantId, delta, now);

        if (updated == 0) {
            int available = variantRepository.findStockById(variantId)
                    .orElseThrow(() -> variantNotFound(variantId));
            log.warn("Rejected stock change for {} ({}): current {}, requested {}",
                    variant.getSku(), variantId, available, -delta);
            throw new InsufficientStockException(variantId, available, -delta);
        }

        // Read back while this transaction still holds the row lock from the update
        int newStock = variantRepository.findStockById(variantId)
                .orElseThrow(() -> variantNotFound(variantId));
        int previousStock = newStock - delta;

        StockMovementEntity movement = movementRepository.save(StockMovementEntity.builder()
                .variantId(variantId)
                .orderId(orderId)
                .type(type)
                .quantity(delta)
                .previousStock(previousStock)
                .newStock(newStock)
                .reason(reason)
                .createdBy(actorId)
                .createdAt(now)
                .build());

        eventPublisher.publishEvent(new StockLevelChangedEvent(
                variantId, variant.getSku(), variant.getProductName(), previousStock, newStock, type));

        log.info("Stock {} for {}: {} -> {} ({})", type, variant.getSku(), previousStock, newStock, reason);

        return new StockAdjustment(variantId, variant.getSku(), previousStock, newStock, movement);
    }

    @Transactional(readOnly = true)
    public StockSummary summary() {
        Instant startOfToday = LocalDate.now(ZoneOffset.UTC).atStartOfDay().toInstant(ZoneOffset.UTC);
        Instant sevenDaysAgo = Instant.now().minus(7, ChronoUnit.DAYS);

        return new StockSummary(
                variantRepository.countByActiveTrue(),
                variantRepository.countByActiveTrueAndStockGreaterThan(lowStockThreshold),
                variantRepository.countByActiveTrueAndStockGreaterThanAndStockLessThanEqual(0, lowStockThreshold),
                variantRepository.countByActiveTrueAndStock(0),
                variantRepository.sumActiveStock(),
                movementRepository.countByCreatedAtGreaterThanEqual(startOfToday),
                movementRepository.countByCreatedAtGreaterThanEqual(sevenDaysAgo),
                lowStockThreshold);
    }

    /**
     * Active variants at or below {@code threshold}, emptiest first.
     * Suggested reorder is twice the threshold.
     */
    @Transactional(readOnly = true)
    public Page<LowStockVariant> lowStock(Integer threshold, int page, int size) {
        int limit = threshold == null ? lowStockThreshold : threshold;

        return variantRepository
                .findByActiveTrueAndStockLessThanEqualOrderByStockAsc(limit, PageRequest.of(page, size))
                .map(v -> new LowStockVariant(v.getVariantId(), v.getSku(), v.getProductName(),
                        v.getStock(), limit * 2));
    }

    @Transactional(readOnly = true)
    public Page<StockMovementEntity> movements(MovementFilter filter, int page, int size) {
        Specification<StockMovementEntity> spec = Specification.where(null);
        if (filter.variantId() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("variantId"), filter.variantId()));
        }
        if (filter.type() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("type"), filter.type()));
        }
        if (filter.days() != null && filter.days() > 0) {
            Instant since = Instant.now().minus(filter.days(), ChronoUnit.DAYS);
            spec = spec.and((root, query, cb) -> cb.greaterThanOrEqualTo(root.<Instant>get("createdAt"), since));
        }
        return movementRepository.findAll(spec,
                PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt")));
    }

    public int getLowStockThreshold() {
        return lowStockThreshold;
    }

    // SALE only comes from order settlement; RESTOCK and RETURN only add stock
    private static void checkMovement(MovementType type, int delta, UUID orderId) {
        boolean valid = switch (type) {
            case SALE -> delta < 0 && orderId != null;
            case RESTOCK, RETURN -> delta > 0;
            case ADJUSTMENT -> true;
        };
        if (!valid) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, String.format(
                    "Stock movement %s does not allow quantity %d%s",
                    type, delta, type == MovementType.SALE && orderId == null ? " without an order" : ""));
        }
    }

    private static BusinessException variantNotFound(UUID variantId) {
        return new BusinessException(ErrorCode.VARIANT_NOT_FOUND, "Variant not found: " + variantId);
    }
}
