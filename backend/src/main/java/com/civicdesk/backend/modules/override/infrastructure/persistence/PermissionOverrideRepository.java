package com.civicdesk.backend.modules.override.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.civicdesk.backend.modules.override.domain.PermissionOverride;

public interface PermissionOverrideRepository extends JpaRepository<PermissionOverride, UUID> {

    @Query("""
            select po
              from PermissionOverride po
              join fetch po.permission
             where po.user.id = :userId
             order by po.permission.codename
            """)
    List<PermissionOverride> findByUserId(@Param("userId") UUID userId);

    @Query("""
            select po
              from PermissionOverride po
              join fetch po.permission p
             where po.user.id = :userId
               and p.codename = :codename
            """)
    Optional<PermissionOverride> findByUserIdAndCodename(@Param("userId") UUID userId,
                                                         @Param("codename") String codename);

    @Query("""
            select po
              from PermissionOverride po
              join fetch po.permission
              join fetch po.user
             where po.expiresAt is not null
               and po.expiresAt < :threshold
            """)
    List<PermissionOverride> findExpiredBefore(@Param("threshold") OffsetDateTime threshold);
}
