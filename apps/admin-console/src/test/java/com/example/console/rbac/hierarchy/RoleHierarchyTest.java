package com.example.console.rbac.hierarchy;

import com.example.console.rbac.hierarchy.AncestorWalk.Termination;
import com.example.console.rbac.hierarchy.ParentCheck.Violation;
import com.example.console.rbac.model.Role;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.example.console.util.RoleTestBuilder.SERVICE_ID;
import static com.example.console.util.RoleTestBuilder.aRole;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("RoleHierarchy")
class RoleHierarchyTest {

    private static final int MAX_DEPTH = 10;

    // admin -> editor -> viewer (root)
    private static RoleHierarchy chain() {
        return RoleHierarchy.of(SERVICE_ID, List.of(
                aRole("viewer").build(),
                aRole("editor").withParent("viewer").build(),
                aRole("admin").withParent("editor").build(),
                aRole("auditor").build()));
    }

    @Nested
    @DisplayName("ancestorsOf")
    class AncestorsOf {

        @Test
        @DisplayName("should walk to the root nearest first")
        void shouldWalkToRoot() {
            AncestorWalk walk = chain().ancestorsOf("admin");

            assertThat(walk.ancestors()).extracting(Role::id).containsExactly("editor", "viewer");
            assertThat(walk.termination()).isEqualTo(Termination.ROOT);
            assertThat(walk.isComplete()).isTrue();
        }

        @Test
        @DisplayName("should stop on a cycle")
        void shouldStopOnCycle() {
            RoleHierarchy hierarchy = RoleHierarchy.of(SERVICE_ID, List.of(
                    aRole("a").withParent("b").build(),
                    aRole("b").withParent("c").build(),
                    aRole("c").withParent("a").build()));

            AncestorWalk walk = hierarchy.ancestorsOf("a");

            assertThat(walk.ancestors()).extracting(Role::id).containsExactly("b", "c");
            assertThat(walk.termination()).isEqualTo(Termination.CYCLE);
            assertThat(walk.stoppedAt()).isEqualTo("a");
        }

        @Test
        @DisplayName("should stop on a missing parent")
        void shouldStopOnMissingParent() {
            RoleHierarchy hierarchy = RoleHierarchy.of(SERVICE_ID, List.of(
                    aRole("a").withParent("b").build(),
                    aRole("b").withParent("ghost").build()));

            AncestorWalk walk = hierarchy.ancestorsOf("a");

            assertThat(walk.ancestors()).extracting(Role::id).containsExactly("b");
            assertThat(walk.termination()).isEqualTo(Termination.MISSING_PARENT);
            assertThat(walk.stoppedAt()).isEqualTo("ghost");
        }
    }

    @Nested
    @DisplayName("checkParent")
    class CheckParent {

        @Test
        @DisplayName("should accept a parent elsewhere in the service")
        void shouldAcceptValidParent() {
            assertThat(chain().checkParent("auditor", "admin", MAX_DEPTH).isValid()).isTrue();
        }

        @Test
        @DisplayName("should always accept clearing the parent")
        void shouldAcceptNullParent() {
            assertThat(chain().checkParent("admin", null, MAX_DEPTH).isValid()).isTrue();
        }

        @Test
        @DisplayName("should reject the role itself")
        void shouldRejectSelf() {
            ParentCheck check = chain().checkParent("editor", "editor", MAX_DEPTH);

            assertThat(check.violation()).isEqualTo(Violation.SELF_REFERENCE);
        }

        @Test
        @DisplayName("should reject a descendant as parent")
        void shouldRejectDescendant() {
            ParentCheck check = chain().checkParent("viewer", "admin", MAX_DEPTH);

            assertThat(check.violation()).isEqualTo(Violation.CYCLE);
            assertThat(check.reason()).contains("viewer").contains("admin");
        }

        @Test
        @DisplayName("should reject an unknown parent")
        void shouldRejectUnknownParent() {
            ParentCheck check = chain().checkParent("editor", "ghost", MAX_DEPTH);

            assertThat(check.violation()).isEqualTo(Violation.UNKNOWN_PARENT);
            assertThat(check.reason()).contains("does not exist");
        }

        @Test
        @DisplayName("should reject a parent from another service")
        void shouldRejectForeignParent() {
            RoleHierarchy hierarchy = RoleHierarchy.of(SERVICE_ID, List.of(
                    aRole("editor").build(),
                    aRole("billing-admin").withServiceId("svc-billing").build()));

            ParentCheck check = hierarchy.checkParent("editor", "billing-admin", MAX_DEPTH);

            assertThat(check.violation()).isEqualTo(Violation.UNKNOWN_PARENT);
            assertThat(check.reason()).contains("different service");
        }

        @Test
        @DisplayName("should reject a parent whose chain is already broken")
        void shouldRejectBrokenChain() {
            RoleHierarchy hierarchy = RoleHierarchy.of(SERVICE_ID, List.of(
                    aRole("x").build(),
                    aRole("orphan").withParent("ghost").build()));

            assertThat(hierarchy.checkParent("x", "orphan", MAX_DEPTH).violation())
                    .isEqualTo(Violation.BROKEN_CHAIN);
        }

        @Test
        @DisplayName("should reject a chain deeper than the limit")
        void shouldRejectTooDeep() {
            List<Role> roles = new ArrayList<>();
            roles.add(aRole("r0").build());
            for (int i = 1; i < 10; i++) {
                roles.add(aRole("r" + i).withParent("r" + (i - 1)).build());
            }
            roles.add(aRole("leaf").build());
            RoleHierarchy hierarchy = RoleHierarchy.of(SERVICE_ID, roles);

            assertThat(hierarchy.checkParent("leaf", "r8", MAX_DEPTH).isValid()).isTrue();
            assertThat(hierarchy.checkParent("leaf", "r9", MAX_DEPTH).violation())
                    .isEqualTo(Violation.DEPTH_EXCEEDED);
        }

        @Test
        @DisplayName("should validate a parent for a role that does not exist yet")
        void shouldValidateForNewRole() {
            assertThat(chain().checkParent(null, "admin", MAX_DEPTH).isValid()).isTrue();
            assertThat(chain().checkParent(null, "ghost", MAX_DEPTH).isValid()).isFalse();
        }
    }

    @Nested
    @DisplayName("detectAnomalies")
    class DetectAnomalies {

        @Test
        @DisplayName("should report nothing for a clean hierarchy")
        void shouldReportNothing() {
            assertThat(chain().detectAnomalies().isEmpty()).isTrue();
        }

        @Test
        @DisplayName("should report orphaned, cyclic and cross-service roles")
        void shouldReportAllKinds() {
            RoleHierarchy hierarchy = RoleHierarchy.of(SERVICE_ID, List.of(
                    aRole("orphan").withParent("ghost").build(),
                    aRole("a").withParent("b").build(),
                    aRole("b").withParent("a").build(),
                    aRole("tail").withParent("a").build(),
                    aRole("borrower").withParent("foreign").build(),
                    aRole("foreign").withServiceId("svc-other").build(),
                    aRole("root").build()));

            HierarchyAnomalies anomalies = hierarchy.detectAnomalies();

            assertThat(anomalies.orphaned())
                    .extracting(Role::id, Role::parentRoleId)
                    .containsExactly(tuple("orphan", "ghost"));
            assertThat(anomalies.cyclic()).extracting(Role::id).containsExactlyInAnyOrder("a", "b", "tail");
            assertThat(anomalies.crossService())
                    .extracting(Role::id, Role::parentRoleId)
                    .containsExactly(tuple("borrower", "foreign"));
        }

        @Test
        @DisplayName("should not throw on malformed input")
        void shouldTolerateMalformedInput() {
            List<Role> roles = new ArrayList<>();
            roles.add(null);
            roles.add(new Role(null, SERVICE_ID, "nameless", null, null));
            roles.add(aRole("self").withParent("self").build());
            roles.add(aRole("dup").build());
            roles.add(aRole("dup").withParent("self").build());

            assertThatCode(() -> RoleHierarchy.of(SERVICE_ID, roles).detectAnomalies()).doesNotThrowAnyException();
            assertThat(RoleHierarchy.of(SERVICE_ID, roles).detectAnomalies().cyclic())
                    .extracting(Role::id)
                    .containsExactly("self");
        }

        @Test
        @DisplayName("should terminate on a large cyclic graph")
        void shouldTerminateOnLargeCycle() {
            List<Role> roles = new ArrayList<>();
            int size = 500;
            for (int i = 0; i < size; i++) {
                roles.add(aRole("r" + i).withParent("r" + ((i + 1) % size)).build());
            }

            HierarchyAnomalies anomalies = RoleHierarchy.of(SERVICE_ID, roles).detectAnomalies();

            assertThat(anomalies.cyclic()).hasSize(size);
            assertThat(anomalies.orphaned()).isEmpty();
        }
    }
}
