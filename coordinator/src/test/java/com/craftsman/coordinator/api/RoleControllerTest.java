package com.craftsman.coordinator.api;

import com.craftsman.coordinator.CanonicalRoles;
import com.craftsman.coordinator.role.CapabilitySet;
import com.craftsman.coordinator.role.PathScope;
import com.craftsman.coordinator.role.RoleDefinition;
import com.craftsman.coordinator.role.RoleRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static com.craftsman.coordinator.tool.OperationKind.READ_FILE;
import static com.craftsman.coordinator.tool.OperationKind.SEARCH;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RoleController.class)
class RoleControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean RoleRegistry roles;

    @Test
    void listRoles_returnsSummariesWithoutPersonaText() throws Exception {
        when(roles.all()).thenReturn(CanonicalRoles.ALL);

        mockMvc.perform(get("/roles"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(4))
                .andExpect(jsonPath("$[0].id").value("coder"))
                .andExpect(jsonPath("$[2].capabilities.WRITE_FILE[0]").value("**.md"))
                .andExpect(jsonPath("$[1].personaLength").value("You are the Researcher.".length()))
                .andExpect(jsonPath("$[1].configBlob").doesNotExist());
    }

    @Test
    void getRole_known_returns200() throws Exception {
        when(roles.contains("planner")).thenReturn(true);
        when(roles.lookup("planner")).thenReturn(CanonicalRoles.PLANNER);

        mockMvc.perform(get("/roles/planner"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.maxSteps").value(20))
                .andExpect(jsonPath("$.capabilities.READ_FILE").isEmpty());
    }

    @Test
    void getRole_protectedPaths_listedPerKind() throws Exception {
        RoleDefinition auditor = new RoleDefinition("auditor", "Reads config", CapabilitySet.of(SEARCH)
                .with(READ_FILE, PathScope.UNRESTRICTED.denying(List.of("**.env"), List.of("**.env.example"))),
                "", 10);
        when(roles.contains("auditor")).thenReturn(true);
        when(roles.lookup("auditor")).thenReturn(auditor);

        mockMvc.perform(get("/roles/auditor"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.capabilities.READ_FILE").isEmpty())
                .andExpect(jsonPath("$.protectedPaths.READ_FILE[0]").value("**.env"))
                .andExpect(jsonPath("$.protectedPaths.SEARCH").doesNotExist());
    }

    @Test
    void getRole_unknown_returns404() throws Exception {
        when(roles.contains("architect")).thenReturn(false);

        mockMvc.perform(get("/roles/architect"))
                .andExpect(status().isNotFound());
    }
}
