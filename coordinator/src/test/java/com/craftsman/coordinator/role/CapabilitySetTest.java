package com.craftsman.coordinator.role;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.craftsman.coordinator.tool.OperationKind.*;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for CapabilitySet and PathScope.
 */
class CapabilitySetTest {

    static final PathScope PLAN_PATHS = PathScope.of(List.of("**.md", "**plan**"));

    // ------------------------------------------------------------------
    // CapabilitySet
    // ------------------------------------------------------------------

    @Test
    void with_returnsNewSet_originalUnchanged() {
        CapabilitySet base = CapabilitySet.of(READ_FILE);
        CapabilitySet more = base.with(SEARCH, PathScope.UNRESTRICTED);

        assertThat(base.kinds()).containsExactly(READ_FILE);
        assertThat(more.kinds()).containsExactlyInAnyOrder(READ_FILE, SEARCH);
    }

    @Test
    void missing_returnsOnlyKindsNotHeld() {
        CapabilitySet researcher = CapabilitySet.of(READ_FILE, SEARCH);

        assertThat(researcher.missing(List.of(READ_FILE, WRITE_FILE, EXECUTE_SHELL)))
                .containsExactly(EXECUTE_SHELL, WRITE_FILE);
        assertThat(researcher.containsAll(List.of(SEARCH, READ_FILE))).isTrue();
    }

    @Test
    void restrictTo_keepsScopesAndDropsUnheldKinds() {
        CapabilitySet planner = CapabilitySet.of(READ_FILE).with(WRITE_FILE, PLAN_PATHS);

        CapabilitySet narrowed = planner.restrictTo(List.of(WRITE_FILE, EXECUTE_SHELL));

        assertThat(narrowed.kinds()).containsExactly(WRITE_FILE);
        assertThat(narrowed.scopeOf(WRITE_FILE)).isEqualTo(PLAN_PATHS);
    }

    @Test
    void intersect_combinesPathScopes() {
        CapabilitySet coder   = CapabilitySet.of(READ_FILE, WRITE_FILE);
        CapabilitySet planner = CapabilitySet.of(READ_FILE).with(WRITE_FILE, PLAN_PATHS);
        CapabilitySet docsOnly = CapabilitySet.of(READ_FILE).with(WRITE_FILE, PathScope.of(List.of("docs/**")));

        CapabilitySet fromPlanner = coder.intersect(planner);
        assertThat(fromPlanner.permits(WRITE_FILE, "docs/plan.md")).isTrue();
        assertThat(fromPlanner.permits(WRITE_FILE, "src/Main.java")).isFalse();

        CapabilitySet both = planner.intersect(docsOnly);
        assertThat(both.permits(WRITE_FILE, "docs/plan.md")).isTrue();
        assertThat(both.permits(WRITE_FILE, "PLAN.md")).isFalse();
        assertThat(both.permits(WRITE_FILE, "docs/Main.java")).isFalse();
    }

    @Test
    void permits_unscopedKind_ignoresPath() {
        CapabilitySet set = CapabilitySet.of(SEARCH);

        assertThat(set.permits(SEARCH, null)).isTrue();
        assertThat(set.permits(SEARCH, "/etc/passwd")).isTrue();
        assertThat(set.permits(READ_FILE, "a.txt")).isFalse();
    }

    @Test
    void asMap_serialisesKindNamesWithGlobs() {
        CapabilitySet planner = CapabilitySet.of(READ_FILE).with(WRITE_FILE, PLAN_PATHS);

        Map<String, PathScope> map = planner.asMap();

        assertThat(map).containsOnlyKeys("READ_FILE", "WRITE_FILE");
        assertThat(map.get("WRITE_FILE").globs()).containsExactly("**.md", "**plan**");
        assertThat(planner).hasToString("{READ_FILE, WRITE_FILE[**.md,**plan**]}");
    }

    // ------------------------------------------------------------------
    // PathScope
    // ------------------------------------------------------------------

    @Test
    void pathScope_planArtifacts_matchAtAnyDepth() {
        assertThat(PLAN_PATHS.allows("PLAN.md")).isTrue();
        assertThat(PLAN_PATHS.allows("docs/design/notes.md")).isTrue();
        assertThat(PLAN_PATHS.allows("plans/step-1.txt")).isTrue();
        assertThat(PLAN_PATHS.allows("src/main/java/Foo.java")).isFalse();
    }

    @Test
    void pathScope_normalisesBeforeMatching() {
        PathScope plans = PathScope.of(List.of("plans/**"));

        assertThat(plans.allows("plans/a/../b.txt")).isTrue();
        assertThat(plans.allows("plans/../src/Main.java")).isFalse();
    }

    @Test
    void pathScope_missingPath_deniedWhenRestricted() {
        assertThat(PLAN_PATHS.allows(null)).isFalse();
        assertThat(PLAN_PATHS.allows("  ")).isFalse();
        assertThat(PathScope.UNRESTRICTED.allows(null)).isTrue();
    }

    @Test
    void pathScope_emptyGlobList_isUnrestricted() {
        assertThat(PathScope.of(List.of())).isSameAs(PathScope.UNRESTRICTED);
        assertThat(PathScope.of(null).isUnrestricted()).isTrue();
    }

    @Test
    void pathScope_protectedPaths_denyWinsUnlessExcepted() {
        PathScope secrets = PathScope.UNRESTRICTED.denying(List.of("**.env", "**.env.*"), List.of("**.env.example"));

        assertThat(secrets.isUnrestricted()).isFalse();
        assertThat(secrets.allows(".env")).isFalse();
        assertThat(secrets.allows("config/.env.production")).isFalse();
        assertThat(secrets.allows("config/.env.example")).isTrue();
        assertThat(secrets.allows("src/Main.java")).isTrue();
        assertThat(secrets.allows(null)).isTrue();
    }

    @Test
    void pathScope_protectedPaths_surviveIntersection() {
        PathScope secrets = PathScope.UNRESTRICTED.denying(List.of("**.env"), List.of());
        PathScope docs = PathScope.of(List.of("docs/**"));

        PathScope narrowed = docs.intersect(secrets);

        assertThat(narrowed.allows("docs/guide.md")).isTrue();
        assertThat(narrowed.allows("docs/.env")).isFalse();
        assertThat(narrowed.deniedGlobs()).containsExactly("**.env");
        assertThat(CapabilitySet.of(READ_FILE).intersect(CapabilitySet.of(READ_FILE).with(READ_FILE, secrets))
                .permits(READ_FILE, "a/.env")).isFalse();
    }
}
