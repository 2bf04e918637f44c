package com.craftsman.coordinator;

import com.craftsman.coordinator.model.ErrorKind;
import com.craftsman.coordinator.model.Outcome;
import com.craftsman.coordinator.role.RoleDefinition;
import com.craftsman.coordinator.role.RoleRegistry;
import com.craftsman.coordinator.service.CoordinatorService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static com.craftsman.coordinator.tool.OperationKind.*;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the full context with the shipped application.yml.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
class CoordinatorApplicationTest {

    @Autowired RoleRegistry       roles;
    @Autowired CoordinatorService coordinator;

    @Test
    void shippedRoleTable_hasFourCanonicalRoles() {
        assertThat(roles.all()).extracting(RoleDefinition::roleId)
                .containsExactly("coder", "researcher", "planner", "reviewer");

        assertThat(roles.lookup("coder").capabilities().kinds())
                .containsExactlyInAnyOrder(READ_FILE, WRITE_FILE, SEARCH, EXECUTE_SHELL, CREATE_PLAN);
        assertThat(roles.lookup("researcher").capabilities().kinds()).containsExactlyInAnyOrder(READ_FILE, SEARCH);
        assertThat(roles.lookup("planner").capabilities().permits(WRITE_FILE, "PLAN.md")).isTrue();
        assertThat(roles.lookup("planner").capabilities().permits(WRITE_FILE, "src/Main.java")).isFalse();
        assertThat(roles.lookup("coder").maxSteps()).isEqualTo(100);
        assertThat(roles.lookup("coder").capabilities().permits(READ_FILE, ".env")).isFalse();
        assertThat(roles.lookup("reviewer").capabilities().permits(READ_FILE, ".env.example")).isTrue();
        assertThat(roles.lookup("reviewer").configBlob()).isNotBlank();
    }

    @Test
    void roleWithoutBehavior_failsCleanly() {
        Outcome outcome = coordinator.runRootTask("researcher", "find callers of X");

        assertThat(outcome.isFailedWith(ErrorKind.BEHAVIOR_UNAVAILABLE)).isTrue();
    }
}
