package com.craftsman.coordinator.role;

import java.util.Objects;

/**
 * Binds a role id to its capabilities and its persona.
 *
 * @param roleId       Unique identifier, e.g. "coder".
 * @param description  One-line summary shown in role listings.
 * @param capabilities Operations this role may invoke; fixed for the life of the process.
 * @param configBlob   Persona text handed to the role behavior. Opaque: the
 *                     coordinator stores it and never looks inside.
 * @param maxSteps     Upper bound on gateway invocations per TaskContext of this role.
 */
public record RoleDefinition(
        String        roleId,
        String        description,
        CapabilitySet capabilities,
        String        configBlob,
        int           maxSteps) {

    public static final int DEFAULT_MAX_STEPS = 50;

    public RoleDefinition {
        Objects.requireNonNull(roleId, "roleId");
        if (roleId.isBlank()) {
            throw new IllegalArgumentException("roleId must not be blank");
        }
        capabilities = capabilities == null ? CapabilitySet.empty() : capabilities;
        configBlob   = configBlob == null ? "" : configBlob;
        description  = description == null ? "" : description;
        if (maxSteps <= 0) {
            maxSteps = DEFAULT_MAX_STEPS;
        }
    }

    public static RoleDefinition of(String roleId, CapabilitySet capabilities, String configBlob) {
        return new RoleDefinition(roleId, "", capabilities, configBlob, DEFAULT_MAX_STEPS);
    }
}
