package com.civicdesk.backend.modules.audit.infrastructure.persistence;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

import com.civicdesk.backend.modules.audit.domain.AuditLog;

@Repository
public class AuditLogRepositoryImpl implements AuditLogRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public Page<AuditLog> search(AuditLogSearchCondition condition, Pageable pageable) {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(pageable, "pageable must not be null");

        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();

        if (condition.actorUserId() != null) {
            whereClauses.add("a.actorUserId = :actorUserId");
            params.put("actorUserId", condition.actorUserId());
        }
        if (condition.resourceType() != null) {
            whereClauses.add("a.resourceType = :resourceType");
            params.put("resourceType", condition.resourceType());
        }
        if (StringUtils.hasText(condition.resourceKey())) {
            whereClauses.add("a.resourceKey = :resourceKey");
            params.put("resourceKey", condition.resourceKey());
        }
        if (condition.from() != null) {
            whereClauses.add("a.createdAt >= :from");
            params.put("from", condition.from());
        }
        if (condition.to() != null) {
            whereClauses.add("a.createdAt < :to");
            params.put("to", condition.to());
        }

        String whereJpql = whereClauses.isEmpty() ? "" : " where " + String.join(" and ", whereClauses);

        TypedQuery<Long> countQuery = entityManager.createQuery(
                "select count(a) from AuditLog a" + whereJpql, Long.class);
        params.forEach(countQuery::setParameter);
        long total = countQuery.getSingleResult();

        if (total == 0) {
            return new PageImpl<>(List.of(), pageable, 0);
        }

        TypedQuery<AuditLog> dataQuery = entityManager.createQuery(
                "select a from AuditLog a" + whereJpql + " order by a.sequenceNo asc", AuditLog.class);
        params.forEach(dataQuery::setParameter);
        dataQuery.setFirstResult((int) pageable.getOffset());
        dataQuery.setMaxResults(pageable.getPageSize());

        return new PageImpl<>(dataQuery.getResultList(), pageable, total);
    }
}
