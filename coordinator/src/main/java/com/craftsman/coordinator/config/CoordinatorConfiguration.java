package com.craftsman.coordinator.config;

import com.craftsman.coordinator.role.CapabilitySet;
import com.craftsman.coordinator.role.PathScope;
import com.craftsman.coordinator.role.RoleDefinition;
import com.craftsman.coordinator.role.RoleRegistry;
import com.craftsman.coordinator.tool.OperationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the frozen role table from {@link CoordinatorProperties}.
 *
 * Any problem in the table (blank id, duplicate id, a path scope or
 * protected path for an unlisted capability, missing prompt resource)
 * throws here and fails application startup.
 */
@Configuration
public class CoordinatorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorConfiguration.class);

    @Bean
    public RoleRegistry roleRegistry(CoordinatorProperties properties) {
        RoleRegistry registry = new RoleRegistry();
        for (CoordinatorProperties.Role entry : properties.getRoles()) {
            registry.register(toDefinition(entry, properties.getProtectedPaths()));
        }
        if (properties.getRoles().isEmpty()) {
            log.warn("No roles configured under craftsman.coordinator.roles");
        }
        return registry.freeze();
    }

    static RoleDefinition toDefinition(CoordinatorProperties.Role entry,
                                       Map<String, CoordinatorProperties.ProtectedPaths> shared) {
        String id = entry.getId();
        if (id == null || id.isBlank()) {
            throw new IllegalStateException("Role entry without an id in craftsman.coordinator.roles");
        }

        Map<OperationKind, PathScope> grants = new LinkedHashMap<>();
        for (String name : entry.getCapabilities()) {
            grants.put(OperationKind.of(name), PathScope.UNRESTRICTED);
        }
        for (Map.Entry<String, List<String>> scope : entry.getPathScopes().entrySet()) {
            OperationKind kind = OperationKind.of(scope.getKey());
            if (!grants.containsKey(kind)) {
                throw new IllegalStateException("Role '" + id + "' scopes " + kind
                        + " but does not list it under capabilities");
            }
            grants.put(kind, PathScope.of(scope.getValue()));
        }
        protect(grants, shared);
        for (OperationKind kind : protect(grants, entry.getProtectedPaths())) {
            if (!grants.containsKey(kind)) {
                throw new IllegalStateException("Role '" + id + "' protects paths for " + kind
                        + " but does not list it under capabilities");
            }
        }

        return new RoleDefinition(id, entry.getDescription(), CapabilitySet.of(grants),
                loadPrompt(id, entry.getPrompt()), entry.getMaxSteps());
    }

    /** Applies {@code table} to the kinds in {@code grants}; returns every kind the table names. */
    private static List<OperationKind> protect(Map<OperationKind, PathScope> grants,
                                               Map<String, CoordinatorProperties.ProtectedPaths> table) {
        List<OperationKind> named = new ArrayList<>();
        table.forEach((name, paths) -> {
            OperationKind kind = OperationKind.of(name);
            named.add(kind);
            grants.computeIfPresent(kind, (k, scope) -> scope.denying(paths.getDeny(), paths.getExcept()));
        });
        return named;
    }

    private static String loadPrompt(String roleId, Resource prompt) {
        if (prompt == null) {
            return "";
        }
        if (!prompt.exists()) {
            throw new IllegalStateException("Prompt for role '" + roleId + "' not found: " + prompt.getDescription());
        }
        try {
            return prompt.getContentAsString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read prompt for role '" + roleId + "'", e);
        }
    }
}
