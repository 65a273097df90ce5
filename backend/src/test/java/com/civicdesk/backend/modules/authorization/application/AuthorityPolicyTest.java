package com.civicdesk.backend.modules.authorization.application;

import static com.civicdesk.backend.support.RbacFixtures.ADMIN_ID;
import static com.civicdesk.backend.support.RbacFixtures.CHIEF_OF_STAFF_ID;
import static com.civicdesk.backend.support.RbacFixtures.CONSTITUENT_ID;
import static com.civicdesk.backend.support.RbacFixtures.COORDINATOR_ID;
import static com.civicdesk.backend.support.RbacFixtures.ROOT_ID;
import static com.civicdesk.backend.support.RbacFixtures.STAFF_ID;
import static com.civicdesk.backend.support.RbacFixtures.subject;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.civicdesk.backend.modules.authorization.domain.AuthorizationSnapshot;
import com.civicdesk.backend.modules.authorization.domain.OverridePolarity;
import com.civicdesk.backend.modules.authorization.domain.PermissionResolver;
import com.civicdesk.backend.modules.authorization.domain.RbacException;
import com.civicdesk.backend.modules.authorization.domain.RbacViolation;
import com.civicdesk.backend.modules.authorization.domain.SubjectContext;
import com.civicdesk.backend.support.RbacFixtures;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

class AuthorityPolicyTest {

    private final AuthorizationSnapshot snapshot = RbacFixtures.snapshot();
    private final AuthorityPolicy policy = new AuthorityPolicy(new PermissionResolver(RbacFixtures.properties()));

    private final SubjectContext root = subject(ROOT_ID, "superuser");
    private final SubjectContext chief = subject(CHIEF_OF_STAFF_ID, "chief_of_staff");
    private final SubjectContext admin = subject(ADMIN_ID, "admin");
    private final SubjectContext coordinator = subject(COORDINATOR_ID, "coordinator");
    private final SubjectContext staff = subject(STAFF_ID, "staff");
    private final SubjectContext constituent = subject(CONSTITUENT_ID, "registered_user");

    @Nested
    class Transitions {

        @Test
        void adminPromotesBelowOwnLevel() {
            assertThatCode(() -> policy.checkTransition(snapshot, admin, constituent, "coordinator"))
                    .doesNotThrowAnyException();
        }

        @Test
        void cannotAssignRoleAtOwnLevel() {
            expect(RbacViolation.INSUFFICIENT_AUTHORITY,
                    () -> policy.checkTransition(snapshot, admin, constituent, "admin"));
        }

        @Test
        void cannotChangeUserAtOrAboveOwnLevel() {
            expect(RbacViolation.INSUFFICIENT_AUTHORITY,
                    () -> policy.checkTransition(snapshot, coordinator, admin, "staff"));
        }

        @Test
        void selfPromotionIsEscalation() {
            expect(RbacViolation.SELF_ESCALATION,
                    () -> policy.checkTransition(snapshot, admin, admin, "chief_of_staff"));
        }

        @Test
        void onlyTopLevelAssignsTopLevelRole() {
            expect(RbacViolation.INSUFFICIENT_AUTHORITY,
                    () -> policy.checkTransition(snapshot, chief, constituent, "superuser"));
            assertThatCode(() -> policy.checkTransition(snapshot, root, constituent, "superuser"))
                    .doesNotThrowAnyException();
        }

        @Test
        void topLevelMayChangeAnyone() {
            assertThatCode(() -> policy.checkTransition(snapshot, root, chief, "staff"))
                    .doesNotThrowAnyException();
        }

        @Test
        void unknownRoleInactiveTargetAndNoOpAreRejected() {
            expect(RbacViolation.UNKNOWN_TARGET_ROLE,
                    () -> policy.checkTransition(snapshot, root, staff, "janitor"));
            expect(RbacViolation.USER_INACTIVE,
                    () -> policy.checkTransition(snapshot, root, RbacFixtures.inactive(STAFF_ID, "staff"), "admin"));
            expect(RbacViolation.ROLE_UNCHANGED,
                    () -> policy.checkTransition(snapshot, root, staff, "staff"));
        }

        @Test
        void missingOrInactiveActorHasNoAuthority() {
            expect(RbacViolation.INSUFFICIENT_AUTHORITY,
                    () -> policy.checkTransition(snapshot, null, constituent, "staff"));
            expect(RbacViolation.INSUFFICIENT_AUTHORITY,
                    () -> policy.checkTransition(snapshot, RbacFixtures.inactive(ADMIN_ID, "admin"), constituent, "staff"));
        }
    }

    @Nested
    class Overrides {

        @Test
        void denyNeedsOnlyHigherLevel() {
            assertThatCode(() -> policy.checkOverride(snapshot, admin, staff, "edit_referral", OverridePolarity.DENY))
                    .doesNotThrowAnyException();
        }

        @Test
        void grantNeedsDelegableGrant() {
            assertThatCode(() -> policy.checkOverride(snapshot, admin, constituent, "edit_referral", OverridePolarity.GRANT))
                    .doesNotThrowAnyException();
            expect(RbacViolation.INSUFFICIENT_AUTHORITY,
                    () -> policy.checkOverride(snapshot, admin, constituent, "view_audit_logs", OverridePolarity.GRANT));
        }

        @Test
        void targetAtSameLevelIsOutOfReach() {
            expect(RbacViolation.INSUFFICIENT_AUTHORITY,
                    () -> policy.checkOverride(snapshot, staff, subject(CONSTITUENT_ID, "staff"), "edit_referral",
                            OverridePolarity.DENY));
        }

        @Test
        void topLevelGrantsAnything() {
            assertThatCode(() -> policy.checkOverride(snapshot, root, chief, "view_audit_logs", OverridePolarity.GRANT))
                    .doesNotThrowAnyException();
        }
    }

    private static void expect(RbacViolation violation, Executable call) {
        assertThatThrownBy(call::execute)
                .isInstanceOf(RbacException.class)
                .extracting(ex -> ((RbacException) ex).getViolation())
                .isEqualTo(violation);
    }
}
