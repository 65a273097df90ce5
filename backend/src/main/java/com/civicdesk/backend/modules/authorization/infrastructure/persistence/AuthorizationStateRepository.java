package com.civicdesk.backend.modules.authorization.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuthorizationStateRepository extends JpaRepository<AuthorizationState, Short> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select s
              from AuthorizationState s
             where s.id = :id
            """)
    Optional<AuthorizationState> findByIdForUpdate(@Param("id") Short id);

    @Query(value = """
            select s.catalog_version    as "catalogVersion",
                   u.permission_version as "userVersion"
              from authorization_state s
              left join portal_user u on u.id = :userId
             where s.id = 1
            """, nativeQuery = true)
    Optional<VersionProjection> findVersions(@Param("userId") UUID userId);

    interface VersionProjection {

        Long getCatalogVersion();

        Long getUserVersion();
    }
}
