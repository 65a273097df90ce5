package com.civicdesk.backend.modules.notification.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.civicdesk.backend.modules.notification.domain.Notification;
import com.civicdesk.backend.modules.notification.domain.NotificationState;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    Optional<Notification> findByIdAndUserId(UUID id, UUID userId);

    long countByUserIdAndState(UUID userId, NotificationState state);

    @Query("""
            select n
              from Notification n
             where n.userId = :userId
             order by n.createdAt desc
            """)
    Page<Notification> findByUserIdOrderByCreatedAtDesc(@Param("userId") UUID userId, Pageable pageable);
}
