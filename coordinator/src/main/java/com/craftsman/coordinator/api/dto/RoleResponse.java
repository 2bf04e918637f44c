package com.craftsman.coordinator.api.dto;

import com.craftsman.coordinator.role.RoleDefinition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only role summary for GET /roles. Capabilities map each kind to its
 * path globs (empty for unrestricted); protectedPaths lists the globs a kind
 * refuses, for kinds that have any. The persona itself is not returned.
 */
public record RoleResponse(
        String                    id,
        String                    description,
        Map<String, List<String>> capabilities,
        Map<String, List<String>> protectedPaths,
        int                       maxSteps,
        int                       personaLength
) {
    public static RoleResponse from(RoleDefinition def) {
        Map<String, List<String>> caps = new LinkedHashMap<>();
        Map<String, List<String>> protectedPaths = new LinkedHashMap<>();
        def.capabilities().asMap().forEach((kind, scope) -> {
            caps.put(kind, scope.globs());
            if (!scope.deniedGlobs().isEmpty()) {
                protectedPaths.put(kind, scope.deniedGlobs());
            }
        });
        return new RoleResponse(
                def.roleId(),
                def.description(),
                caps,
                protectedPaths,
                def.maxSteps(),
                def.configBlob().length()
        );
    }
}
