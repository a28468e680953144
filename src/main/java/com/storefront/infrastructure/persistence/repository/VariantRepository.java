package com.storefront.infrastructure.persistence.repository;

import com.storefront.infrastructure.persistence.entity.VariantEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface VariantRepository extends JpaRepository<VariantEntity, UUID> {

    Optional<VariantEntity> findBySku(String sku);

    /**
     * Lock a set of variants for the rest of the transaction.
     *
     * Rows are returned (and therefore locked) in id order so that two orders sharing
     * variants always acquire their locks in the same sequence.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM VariantEntity v WHERE v.variantId IN :variantIds ORDER BY v.variantId")
    List<VariantEntity> findAllByIdForUpdate(@Param("variantIds") Collection<UUID> variantIds);

    /**
     * Atomically take {@code quantity} units.
     *
     * The stock check and the write are one statement, so two concurrent callers can never
     * both pass the check against the same value.
     *
     * @return 1 if the stock was taken, 0 if the variant is missing or has fewer units
     */
    @Modifying
    @Query("UPDATE VariantEntity v SET v.stock = v.stock - :quantity, v.updatedAt = :now " +
           "WHERE v.variantId = :variantId AND v.stock >= :quantity")
    int decrementStock(@Param("variantId") UUID variantId,
                       @Param("quantity") int quantity,
                       @Param("now") Instant now);

    @Modifying
    @Query("UPDATE VariantEntity v SET v.stock = v.stock + :quantity, v.updatedAt = :now " +
           "WHERE v.variantId = :variantId")
    int incrementStock(@Param("variantId") UUID variantId,
                       @Param("quantity") int quantity,
                       @Param("now") Instant now);

    /**
     * Current stock straight from the database, bypassing any managed entity.
     */
    @Query("SELECT v.stock FROM VariantEntity v WHERE v.variantId = :variantId")
    Optional<Integer> findStockById(@Param("variantId") UUID variantId);

    long countByActiveTrue();

    long countByActiveTrueAndStockGreaterThan(int stock);

    long countByActiveTrueAndStockGreaterThanAndStockLessThanEqual(int lower, int upper);

    long countByActiveTrueAndStock(int stock);

    @Query("SELECT COALESCE(SUM(v.stock), 0) FROM VariantEntity v WHERE v.active = true")
    long sumActiveStock();

    Page<VariantEntity> findByActiveTrueAndStockLessThanEqualOrderByStockAsc(int threshold, Pageable pageable);
}
