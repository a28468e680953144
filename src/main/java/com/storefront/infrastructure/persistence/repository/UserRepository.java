package com.storefront.infrastructure.persistence.repository;

import com.storefront.infrastructure.persistence.entity.UserEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface UserRepository extends JpaRepository<UserEntity, UUID> {

    List<UserEntity> findByRoleInAndActiveTrue(Collection<UserEntity.Role> roles);
}
