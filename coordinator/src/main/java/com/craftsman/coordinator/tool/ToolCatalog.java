package com.craftsman.coordinator.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-process catalog of tool operations.
 *
 * Every {@link ToolOperation} bean is collected at startup via constructor
 * injection. The catalog only binds kinds to collaborators; capability
 * checks, auditing and metrics live in {@link ToolGateway}.
 *
 * Binding two operations to the same kind is a startup error.
 */
@Component
public class ToolCatalog {

    private static final Logger log = LoggerFactory.getLogger(ToolCatalog.class);

    private final Map<OperationKind, ToolOperation> operations = new LinkedHashMap<>();

    public ToolCatalog(List<ToolOperation> allOperations) {
        for (ToolOperation op : allOperations) {
            ToolManifest m = op.manifest();
            ToolOperation previous = operations.putIfAbsent(m.kind(), op);
            if (previous != null) {
                throw new IllegalStateException("Operation " + m.kind() + " is bound twice: "
                        + previous.getClass().getSimpleName() + " and " + op.getClass().getSimpleName());
            }
            log.info("Registered tool operation {} v{} (idempotent={})",
                    m.kind(), m.version(), m.idempotent());
        }
    }

    public Optional<ToolOperation> find(OperationKind kind) {
        return Optional.ofNullable(operations.get(kind));
    }

    public Set<OperationKind> kinds() {
        return operations.keySet();
    }

    /** Manifests of every bound operation, sorted by kind name. */
    public List<ToolManifest> manifests() {
        Collection<ToolOperation> ops = operations.values();
        return ops.stream()
                .map(ToolOperation::manifest)
                .sorted(Comparator.comparing(m -> m.kind().name()))
                .toList();
    }
}
