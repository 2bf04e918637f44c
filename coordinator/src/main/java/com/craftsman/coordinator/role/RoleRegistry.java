package com.craftsman.coordinator.role;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static role table.
 *
 * <p>Populated once at startup by {@code CoordinatorConfiguration} and then
 * frozen. After {@link #freeze()} no mutation exists, so every TaskContext's
 * permissions are decidable from its role id alone and concurrent readers
 * need no synchronisation.
 */
public class RoleRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoleRegistry.class);

    private final Map<String, RoleDefinition> roles = new LinkedHashMap<>();
    private volatile Map<String, RoleDefinition> frozen;

    // ------------------------------------------------------------------
    // Registration (startup only)
    // ------------------------------------------------------------------

    /**
     * @throws DuplicateRoleException if {@code definition.roleId()} is already registered
     * @throws IllegalStateException  if the registry has been frozen
     */
    public synchronized void register(RoleDefinition definition) {
        if (frozen != null) {
            throw new IllegalStateException("Role registry is frozen; cannot register '"
                    + definition.roleId() + "'");
        }
        if (roles.containsKey(definition.roleId())) {
            throw new DuplicateRoleException(definition.roleId());
        }
        roles.put(definition.roleId(), definition);
        log.info("Registered role '{}' capabilities={} maxSteps={} persona={} chars",
                definition.roleId(), definition.capabilities(),
                definition.maxSteps(), definition.configBlob().length());
    }

    public synchronized RoleRegistry freeze() {
        if (frozen == null) {
            frozen = Collections.unmodifiableMap(new LinkedHashMap<>(roles));
        }
        return this;
    }

    public boolean isFrozen() { return frozen != null; }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public RoleDefinition lookup(String roleId) {
        RoleDefinition def = view().get(roleId);
        if (def == null) {
            throw new UnknownRoleException(roleId);
        }
        return def;
    }

    public boolean contains(String roleId) {
        return roleId != null && view().containsKey(roleId);
    }

    /** All roles, in registration order. */
    public Collection<RoleDefinition> all() {
        return List.copyOf(view().values());
    }

    private Map<String, RoleDefinition> view() {
        Map<String, RoleDefinition> f = frozen;
        if (f != null) {
            return f;
        }
        synchronized (this) {
            return new LinkedHashMap<>(roles);
        }
    }
}
