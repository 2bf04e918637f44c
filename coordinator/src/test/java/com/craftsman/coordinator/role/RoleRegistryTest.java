package com.craftsman.coordinator.role;

import com.craftsman.coordinator.model.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.craftsman.coordinator.tool.OperationKind.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoleRegistryTest {

    RoleRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new RoleRegistry();
        registry.register(RoleDefinition.of("coder", CapabilitySet.of(READ_FILE, WRITE_FILE), "persona"));
        registry.register(RoleDefinition.of("researcher", CapabilitySet.of(READ_FILE, SEARCH), ""));
    }

    @Test
    void register_duplicateId_throwsDuplicateRole() {
        assertThatThrownBy(() -> registry.register(RoleDefinition.of("coder", CapabilitySet.empty(), "")))
                .isInstanceOf(DuplicateRoleException.class)
                .hasMessageContaining("coder")
                .satisfies(e -> assertThat(((DuplicateRoleException) e).getKind()).isEqualTo(ErrorKind.DUPLICATE_ROLE));
    }

    @Test
    void lookup_unknownId_throwsUnknownRole() {
        assertThatThrownBy(() -> registry.lookup("architect"))
                .isInstanceOf(UnknownRoleException.class)
                .hasMessageStartingWith("[UNKNOWN_ROLE]")
                .hasMessageContaining("architect");
    }

    @Test
    void freeze_blocksFurtherRegistration() {
        registry.freeze();

        assertThat(registry.isFrozen()).isTrue();
        assertThatThrownBy(() -> registry.register(RoleDefinition.of("planner", CapabilitySet.empty(), "")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void all_keepsRegistrationOrder() {
        registry.freeze();

        assertThat(registry.all()).extracting(RoleDefinition::roleId).containsExactly("coder", "researcher");
        assertThat(registry.lookup("coder").configBlob()).isEqualTo("persona");
        assertThat(registry.contains(null)).isFalse();
    }

    @Test
    void roleDefinition_nonPositiveMaxSteps_fallsBackToDefault() {
        RoleDefinition def = new RoleDefinition("x", null, null, null, 0);

        assertThat(def.maxSteps()).isEqualTo(RoleDefinition.DEFAULT_MAX_STEPS);
        assertThat(def.capabilities().isEmpty()).isTrue();
        assertThat(def.configBlob()).isEmpty();
    }
}
