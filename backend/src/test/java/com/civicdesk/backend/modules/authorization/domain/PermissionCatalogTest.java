package com.civicdesk.backend.modules.authorization.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Set;

import com.civicdesk.backend.support.RbacFixtures;

import org.junit.jupiter.api.Test;

class PermissionCatalogTest {

    private final PermissionCatalog catalog = RbacFixtures.catalog();

    @Test
    void activeGrantIsFoundAnywhereInRoleSet() {
        assertThat(catalog.hasActiveGrant(Set.of("staff", "registered_user"), "view_calendar")).isTrue();
        assertThat(catalog.hasActiveGrant(Set.of("mp"), "view_calendar")).isFalse();
    }

    @Test
    void inactiveGrantDoesNotCount() {
        PermissionCatalog revoked = catalog.withGrant(new RoleGrant("registered_user", "view_calendar", false, false));

        assertThat(revoked.hasActiveGrant(Set.of("registered_user"), "view_calendar")).isFalse();
        assertThat(catalog.hasActiveGrant(Set.of("registered_user"), "view_calendar")).isTrue();
    }

    @Test
    void delegableGrantRequiresFlag() {
        assertThat(catalog.hasDelegableGrant(Set.of("staff"), "edit_referral")).isTrue();
        assertThat(catalog.hasDelegableGrant(Set.of("admin", "staff"), "assign_roles")).isFalse();
    }

    @Test
    void deactivationKeepsPermissionRegistered() {
        PermissionCatalog next = catalog.withActive("manage_events", false);

        assertThat(next.contains("manage_events")).isTrue();
        assertThat(next.isActive("manage_events")).isFalse();
        assertThat(next.listActive()).extracting(PermissionDefinition::codename).doesNotContain("manage_events");
        assertThat(catalog.withActive("view_calendar", true)).isSameAs(catalog);
    }
}
