package com.storefront.infrastructure.persistence.repository;

import com.storefront.infrastructure.persistence.entity.StockMovementEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface StockMovementRepository extends JpaRepository<StockMovementEntity, UUID>,
        JpaSpecificationExecutor<StockMovementEntity> {

    List<StockMovementEntity> findByOrderId(UUID orderId);

    List<StockMovementEntity> findByVariantIdOrderByCreatedAtAsc(UUID variantId);

    long countByOrderIdAndType(UUID orderId, StockMovementEntity.MovementType type);

    long countByCreatedAtGreaterThanEqual(Instant since);
}
