package com.civicdesk.backend.modules.user.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.civicdesk.backend.modules.user.domain.PortalUser;

public interface PortalUserRepository extends JpaRepository<PortalUser, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select u
              from PortalUser u
             where u.id = :id
            """)
    Optional<PortalUser> findByIdForUpdate(@Param("id") UUID id);
}
