package com.civicdesk.backend.support;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.civicdesk.backend.global.config.RbacProperties;
import com.civicdesk.backend.modules.authorization.domain.AuthorizationSnapshot;
import com.civicdesk.backend.modules.authorization.domain.OverrideEntry;
import com.civicdesk.backend.modules.authorization.domain.OverridePolarity;
import com.civicdesk.backend.modules.authorization.domain.PermissionCatalog;
import com.civicdesk.backend.modules.authorization.domain.PermissionDefinition;
import com.civicdesk.backend.modules.authorization.domain.RoleGrant;
import com.civicdesk.backend.modules.authorization.domain.RoleGraph;
import com.civicdesk.backend.modules.authorization.domain.RoleNode;
import com.civicdesk.backend.modules.authorization.domain.SubjectContext;

/**
 * In-memory copy of the seeded CivicDesk role ladder for unit tests.
 */
public final class RbacFixtures {

    public static final UUID ROOT_ID = UUID.fromString("00000000-0000-0000-0000-000000000001");
    public static final UUID CHIEF_OF_STAFF_ID = UUID.fromString("00000000-0000-0000-0000-000000000002");
    public static final UUID ADMIN_ID = UUID.fromString("00000000-0000-0000-0000-000000000003");
    public static final UUID COORDINATOR_ID = UUID.fromString("00000000-0000-0000-0000-000000000004");
    public static final UUID STAFF_ID = UUID.fromString("00000000-0000-0000-0000-000000000005");
    public static final UUID MEMBER_ID = UUID.fromString("00000000-0000-0000-0000-000000000006");
    public static final UUID CONSTITUENT_ID = UUID.fromString("00000000-0000-0000-0000-000000000007");
    public static final UUID FORMER_STAFF_ID = UUID.fromString("00000000-0000-0000-0000-000000000008");

    private RbacFixtures() {
    }

    public static RoleGraph roleGraph() {
        return RoleGraph.of(List.of(
                role("registered_user", 2),
                role("chapter_member", 3, "registered_user"),
                role("staff", 4, "registered_user"),
                role("info_officer", 5, "staff"),
                role("coordinator", 6, "staff"),
                role("admin", 7, "staff"),
                role("chief_of_staff", 8, "admin", "coordinator", "info_officer"),
                role("mp", 9),
                role("superuser", 10, "mp", "chief_of_staff")
        ));
    }

    public static PermissionCatalog catalog() {
        List<PermissionDefinition> definitions = new ArrayList<>();
        for (String codename : List.of("view_calendar", "view_member_directory", "edit_referral",
                "publish_newsletter", "manage_events", "assign_roles", "manage_overrides",
                "view_user_permissions", "view_audit_logs", "manage_roles", "manage_permissions")) {
            definitions.add(new PermissionDefinition(codename, codename, null, "test", true, true));
        }
        List<RoleGrant> grants = List.of(
                new RoleGrant("registered_user", "view_calendar", true, false),
                new RoleGrant("chapter_member", "view_member_directory", true, false),
                new RoleGrant("staff", "edit_referral", true, true),
                new RoleGrant("staff", "view_user_permissions", true, false),
                new RoleGrant("info_officer", "publish_newsletter", true, true),
                new RoleGrant("coordinator", "manage_events", true, true),
                new RoleGrant("admin", "assign_roles", true, false),
                new RoleGrant("admin", "manage_overrides", true, false),
                new RoleGrant("admin", "view_audit_logs", true, false),
                new RoleGrant("chief_of_staff", "manage_roles", true, false),
                new RoleGrant("chief_of_staff", "manage_permissions", true, false)
        );
        return PermissionCatalog.of(definitions, grants);
    }

    public static AuthorizationSnapshot snapshot() {
        return new AuthorizationSnapshot(1L, roleGraph(), catalog());
    }

    public static RbacProperties properties() {
        return new RbacProperties();
    }

    public static SubjectContext subject(UUID userId, String roleCode, OverrideEntry... overrides) {
        return new SubjectContext(userId, roleCode, true, List.of(overrides));
    }

    public static SubjectContext inactive(UUID userId, String roleCode) {
        return new SubjectContext(userId, roleCode, false, List.of());
    }

    public static OverrideEntry override(String codename, OverridePolarity polarity, OffsetDateTime expiresAt) {
        return new OverrideEntry(codename, polarity, expiresAt);
    }

    private static RoleNode role(String code, int level, String... parents) {
        return new RoleNode(code, code, null, level, Set.of(parents));
    }
}
