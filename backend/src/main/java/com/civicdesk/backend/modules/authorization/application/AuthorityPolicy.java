package com.civicdesk.backend.modules.authorization.application;

import com.civicdesk.backend.modules.authorization.domain.AuthorizationSnapshot;
import com.civicdesk.backend.modules.authorization.domain.OverridePolarity;
import com.civicdesk.backend.modules.authorization.domain.PermissionResolver;
import com.civicdesk.backend.modules.authorization.domain.RbacViolation;
import com.civicdesk.backend.modules.authorization.domain.RoleGraph;
import com.civicdesk.backend.modules.authorization.domain.SubjectContext;

import org.springframework.stereotype.Component;

/**
 * Who may change whose role or overrides. Level comparisons use the role graph of the given snapshot.
 */
@Component
public class AuthorityPolicy {

    private final PermissionResolver resolver;

    public AuthorityPolicy(PermissionResolver resolver) {
        this.resolver = resolver;
    }

    public boolean isTopLevel(AuthorizationSnapshot snapshot, SubjectContext subject) {
        return subject != null && subject.active() && resolver.isTopLevel(snapshot.roleGraph(), subject.roleCode());
    }

    /**
     * Rejects a role transition of {@code target} to {@code newRoleCode} requested by {@code actor}.
     */
    public void checkTransition(AuthorizationSnapshot snapshot, SubjectContext actor, SubjectContext target,
                                String newRoleCode) {
        RoleGraph graph = snapshot.roleGraph();
        if (!graph.contains(newRoleCode)) {
            throw RbacViolation.UNKNOWN_TARGET_ROLE.exception("role does not exist: " + newRoleCode);
        }
        if (!target.active()) {
            throw RbacViolation.USER_INACTIVE.exception("user " + target.userId() + " is inactive");
        }
        if (newRoleCode.equals(target.roleCode())) {
            throw RbacViolation.ROLE_UNCHANGED.exception("user already holds role " + newRoleCode);
        }
        requireActiveActor(graph, actor);

        int newLevel = graph.level(newRoleCode);
        int actorLevel = graph.level(actor.roleCode());
        boolean self = actor.userId().equals(target.userId());
        if (self && newLevel > actorLevel) {
            throw RbacViolation.SELF_ESCALATION.exception("cannot raise own role to " + newRoleCode);
        }

        boolean actorTopLevel = isTopLevel(snapshot, actor);
        if (!actorTopLevel && resolver.isTopLevel(graph, newRoleCode)) {
            throw RbacViolation.INSUFFICIENT_AUTHORITY.exception("only a top-level actor may assign " + newRoleCode);
        }
        if (actorTopLevel) {
            return;
        }
        if (newLevel >= actorLevel) {
            throw RbacViolation.INSUFFICIENT_AUTHORITY.exception("cannot assign role " + newRoleCode
                    + " at or above own level");
        }
        if (graph.contains(target.roleCode()) && graph.level(target.roleCode()) >= actorLevel) {
            throw RbacViolation.INSUFFICIENT_AUTHORITY.exception("cannot change the role of a user at or above own level");
        }
    }

    /**
     * Rejects an override change unless the actor outranks the target; creating a GRANT additionally
     * requires a delegable grant of the permission.
     */
    public void checkOverride(AuthorizationSnapshot snapshot, SubjectContext actor, SubjectContext target,
                              String codename, OverridePolarity polarity) {
        RoleGraph graph = snapshot.roleGraph();
        requireActiveActor(graph, actor);
        if (isTopLevel(snapshot, actor)) {
            return;
        }
        int actorLevel = graph.level(actor.roleCode());
        int targetLevel = graph.contains(target.roleCode()) ? graph.level(target.roleCode()) : Integer.MIN_VALUE;
        if (actorLevel <= targetLevel) {
            throw RbacViolation.INSUFFICIENT_AUTHORITY.exception("cannot manage overrides of a user at or above own level");
        }
        if (polarity == OverridePolarity.GRANT
                && !snapshot.catalog().hasDelegableGrant(graph.closure(actor.roleCode()), codename)) {
            throw RbacViolation.INSUFFICIENT_AUTHORITY.exception("no delegable grant of " + codename);
        }
    }

    private void requireActiveActor(RoleGraph graph, SubjectContext actor) {
        if (actor == null || !actor.active() || !graph.contains(actor.roleCode())) {
            throw RbacViolation.INSUFFICIENT_AUTHORITY.exception("actor is not an active portal user");
        }
    }
}
