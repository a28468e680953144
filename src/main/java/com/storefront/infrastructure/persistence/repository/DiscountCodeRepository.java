package com.storefront.infrastructure.persistence.repository;

import com.storefront.infrastructure.persistence.entity.DiscountCodeEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface DiscountCodeRepository extends JpaRepository<DiscountCodeEntity, UUID> {

    Optional<DiscountCodeEntity> findByCode(String code);

    /**
     * Give back one usage consumed at checkout. Never drops below zero.
     */
    @Modifying
    @Query("UPDATE DiscountCodeEntity d SET d.usedCount = d.usedCount - 1 " +
           "WHERE d.code = :code AND d.usedCount > 0")
    int releaseUsage(@Param("code") String code);
}
