package com.craftsman.coordinator.service;

import com.craftsman.coordinator.model.ErrorKind;
import com.craftsman.coordinator.model.Outcome;
import com.craftsman.coordinator.model.TaskFailure;
import com.craftsman.coordinator.role.RoleDefinition;
import com.craftsman.coordinator.role.RoleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;

/**
 * Entry point for callers outside the coordinator (REST, CLI, UI).
 *
 * Never throws for task-level problems: an unknown role or a failed run
 * comes back as a failed {@link Outcome}.
 */
@Service
public class CoordinatorService {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorService.class);

    private final RoleRegistry     roles;
    private final DelegationRouter router;

    public CoordinatorService(RoleRegistry roles, DelegationRouter router) {
        this.roles  = roles;
        this.router = router;
    }

    public Outcome runRootTask(String roleId, String task) {
        return runRootTask(roleId, task, null);
    }

    public Outcome runRootTask(String roleId, String task, Duration timeout) {
        return submitRootTask(roleId, task, timeout).await();
    }

    /**
     * Start a root task and return immediately.
     *
     * @param timeout deadline for the whole run; null uses the configured default
     */
    public RootTaskHandle submitRootTask(String roleId, String task, Duration timeout) {
        if (!roles.contains(roleId)) {
            log.warn("Rejected root task for unknown role '{}'", roleId);
            return finished(Outcome.failed(roleId, new TaskFailure(ErrorKind.UNKNOWN_ROLE,
                    "No role registered with id: '" + roleId + "'", List.of(String.valueOf(roleId)))));
        }
        RoleDefinition role = roles.lookup(roleId);

        TaskContext root;
        try {
            root = router.startRoot(role, task, timeout);
        } catch (RejectedExecutionException e) {
            log.warn("Coordinator is shutting down; rejected root task for '{}'", roleId);
            return finished(Outcome.failed(roleId, new TaskFailure(ErrorKind.CANCELLED,
                    "Coordinator is shutting down", List.of(roleId))));
        }

        CompletableFuture<Outcome> reported = root.completion().whenComplete((outcome, error) -> {
            root.tree().evict(root);
            log.info("Root task {} for '{}' finished: {}", root.rootTaskId(), roleId, outcome.status());
        });
        return new RootTaskHandle(reported, () -> router.cancel(root));
    }

    private static RootTaskHandle finished(Outcome outcome) {
        return new RootTaskHandle(CompletableFuture.completedFuture(outcome), () -> { });
    }
}
