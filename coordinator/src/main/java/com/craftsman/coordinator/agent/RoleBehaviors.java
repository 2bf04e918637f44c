package com.craftsman.coordinator.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Role behaviors by role id, collected from the context at startup. */
@Component
public class RoleBehaviors {

    private static final Logger log = LoggerFactory.getLogger(RoleBehaviors.class);

    private final Map<String, RoleBehavior> byRole = new LinkedHashMap<>();

    public RoleBehaviors(List<RoleBehavior> behaviors) {
        for (RoleBehavior b : behaviors) {
            RoleBehavior previous = byRole.putIfAbsent(b.roleId(), b);
            if (previous != null) {
                throw new IllegalStateException("Two behaviors for role '" + b.roleId() + "': "
                        + previous.getClass().getSimpleName() + " and " + b.getClass().getSimpleName());
            }
            log.info("Registered behavior {} for role '{}'", b.getClass().getSimpleName(), b.roleId());
        }
    }

    public Optional<RoleBehavior> find(String roleId) {
        return Optional.ofNullable(byRole.get(roleId));
    }
}
