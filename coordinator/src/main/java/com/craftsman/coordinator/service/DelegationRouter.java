package com.craftsman.coordinator.service;

import com.craftsman.coordinator.agent.RoleBehavior;
import com.craftsman.coordinator.agent.RoleBehaviors;
import com.craftsman.coordinator.agent.TaskScope;
import com.craftsman.coordinator.config.CoordinatorProperties;
import com.craftsman.coordinator.logging.MdcContext;
import com.craftsman.coordinator.metrics.CoordinatorMetrics;
import com.craftsman.coordinator.model.CoordinationException;
import com.craftsman.coordinator.model.DelegationFailedException;
import com.craftsman.coordinator.model.ErrorKind;
import com.craftsman.coordinator.model.Outcome;
import com.craftsman.coordinator.model.TaskFailure;
import com.craftsman.coordinator.model.TaskStatus;
import com.craftsman.coordinator.role.CapabilitySet;
import com.craftsman.coordinator.role.RoleDefinition;
import com.craftsman.coordinator.role.RoleRegistry;
import com.craftsman.coordinator.tool.OperationKind;
import com.craftsman.coordinator.tool.ToolGateway;
import com.craftsman.coordinator.tool.ToolInvocationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns the task tree: validates and spawns delegations, runs behaviors on
 * the worker pool, retries idempotent tool failures, and tears subtrees
 * down on cancel or deadline.
 *
 * <p>A delegation is checked in this order, and the first failure is
 * returned to the delegator as a failed {@link Outcome}, never thrown:
 * <ol>
 *   <li>UNKNOWN_ROLE: target id not in the role table</li>
 *   <li>CAPABILITY_DENIED: requested kinds not held by the target, or not
 *       held by the delegator itself (a child never gains what its parent lacks)</li>
 *   <li>DELEGATION_LOOP: the same role already works on the same task
 *       (after whitespace and case normalisation) further up the chain</li>
 *   <li>DEPTH_EXCEEDED: the child would sit deeper than the configured limit</li>
 * </ol>
 */
@Service
public class DelegationRouter {

    private static final Logger log = LoggerFactory.getLogger(DelegationRouter.class);

    private final RoleRegistry       roles;
    private final RoleBehaviors      behaviors;
    private final ToolGateway        gateway;
    private final ResultAggregator   aggregator;
    private final WorkerPool         pool;
    private final CoordinatorMetrics metrics;
    private final int                maxDepth;
    private final int                maxRetries;
    private final Duration           defaultTimeout;

    @Autowired
    public DelegationRouter(RoleRegistry roles, RoleBehaviors behaviors, ToolGateway gateway,
                            ResultAggregator aggregator, WorkerPool pool, CoordinatorMetrics metrics,
                            CoordinatorProperties properties) {
        this(roles, behaviors, gateway, aggregator, pool, metrics,
                properties.getMaxDelegationDepth(), properties.getMaxRetries(),
                properties.getDefaultTaskTimeout());
    }

    public DelegationRouter(RoleRegistry roles, RoleBehaviors behaviors, ToolGateway gateway,
                            ResultAggregator aggregator, WorkerPool pool, CoordinatorMetrics metrics,
                            int maxDepth, int maxRetries, Duration defaultTimeout) {
        this.roles          = roles;
        this.behaviors      = behaviors;
        this.gateway        = gateway;
        this.aggregator     = aggregator;
        this.pool           = pool;
        this.metrics        = metrics;
        this.maxDepth       = maxDepth;
        this.maxRetries     = Math.max(0, maxRetries);
        this.defaultTimeout = defaultTimeout;
    }

    // ------------------------------------------------------------------
    // Root runs
    // ------------------------------------------------------------------

    /** Create a fresh tree for {@code role} and start its root task. */
    public TaskContext startRoot(RoleDefinition role, String task, Duration timeout) {
        TaskTree tree = new TaskTree();
        Instant deadline = deadlineAfter(timeout != null ? timeout : defaultTimeout);
        TaskContext root = tree.createRoot(role, task, deadline);
        log.info("Starting root task {} for role '{}'", tree.rootTaskId(), role.roleId());
        launch(root);
        return root;
    }

    // ------------------------------------------------------------------
    // Delegation
    // ------------------------------------------------------------------

    /**
     * Hand a sub-task to another role and block until it resolves.
     * The calling thread's worker permit is released while it waits.
     */
    public Outcome delegate(TaskContext parent, DelegationRequest request) {
        return delegateAll(parent, List.of(request)).get(0);
    }

    /**
     * Start every request concurrently, wait for all of them, and return the
     * outcomes in request order. Rejected requests take their slot as a
     * failed outcome without spawning anything.
     */
    public List<Outcome> delegateAll(TaskContext parent, List<DelegationRequest> requests) {
        List<Outcome>     rejections = new ArrayList<>();
        List<TaskContext> children   = new ArrayList<>();
        for (DelegationRequest request : requests) {
            Outcome rejection = null;
            TaskContext child = null;
            try {
                child = spawn(parent, request);
            } catch (CoordinationException e) {
                rejection = Outcome.failed(request.targetRoleId(),
                        TaskFailure.of(e, chainThrough(parent, request.targetRoleId())));
                log.warn("Delegation {} -> {} rejected: {}", parent.roleId(), request.targetRoleId(), e.getMessage());
                metrics.recordDelegation(parent.roleId(), request.targetRoleId(),
                        e.getKind().name().toLowerCase(Locale.ROOT));
            } catch (RuntimeException e) {
                abandon(children);
                throw e;
            }
            rejections.add(rejection);
            children.add(child);
        }

        List<Outcome> outcomes = pool.suspend(() -> {
            List<Outcome> out = new ArrayList<>();
            for (int i = 0; i < children.size(); i++) {
                TaskContext child = children.get(i);
                out.add(child == null ? rejections.get(i) : await(child));
            }
            return out;
        });

        for (TaskContext child : children) {
            if (child != null) {
                child.tree().evict(child);
            }
        }
        return aggregator.resolveBatch(parent, outcomes);
    }

    /** Cancels and evicts the children a batch already started before it failed. */
    private void abandon(List<TaskContext> started) {
        for (TaskContext child : started) {
            if (child != null) {
                cancel(child);
                child.tree().evict(child);
            }
        }
    }

    private TaskContext spawn(TaskContext parent, DelegationRequest request) {
        if (parent.isCancelled()) {
            throw new CoordinationException(ErrorKind.CANCELLED,
                    "Task of role '" + parent.roleId() + "' was cancelled; no further delegation");
        }
        RoleDefinition target = admit(parent, request);
        Collection<OperationKind> requested = requestedKinds(target, request);
        CapabilitySet grant = target.capabilities().restrictTo(requested).intersect(parent.grant());

        Instant deadline = childDeadline(parent, request.timeout());
        TaskContext child = parent.tree().createChild(parent, target, request.task(), grant, deadline);
        log.info("Delegated {} -> {} (task {}, depth {}, grant {})",
                parent.roleId(), target.roleId(), child.id(), child.depth(), grant);
        metrics.recordDelegation(parent.roleId(), target.roleId(), "accepted");
        metrics.recordDelegationDepth(child.depth());
        try {
            launch(child);
        } catch (RejectedExecutionException e) {
            log.warn("Coordinator is shutting down; task {} ({}) not started", child.id(), target.roleId());
            terminate(child, ErrorKind.CANCELLED, "Coordinator is shutting down");
        }
        return child;
    }

    /** Validates {@code request}; returns the target role or throws the first violation. */
    private RoleDefinition admit(TaskContext parent, DelegationRequest request) {
        RoleDefinition target = roles.lookup(request.targetRoleId());

        Collection<OperationKind> requested = requestedKinds(target, request);
        Set<OperationKind> beyondTarget = target.capabilities().missing(requested);
        if (!beyondTarget.isEmpty()) {
            throw new CoordinationException(ErrorKind.CAPABILITY_DENIED,
                    "Role '" + target.roleId() + "' does not hold " + beyondTarget);
        }
        Set<OperationKind> beyondParent = parent.grant().missing(requested);
        if (!beyondParent.isEmpty()) {
            throw new CoordinationException(ErrorKind.CAPABILITY_DENIED,
                    "Role '" + parent.roleId() + "' cannot grant " + beyondParent + " it does not hold");
        }

        String normalized = normalize(request.task());
        for (TaskContext ancestor : parent.tree().ancestry(parent)) {
            if (ancestor.roleId().equals(target.roleId()) && normalize(ancestor.task()).equals(normalized)) {
                throw new CoordinationException(ErrorKind.DELEGATION_LOOP,
                        "Role '" + target.roleId() + "' is already working on this task at depth "
                                + ancestor.depth());
            }
        }

        int depth = parent.depth() + 1;
        if (depth > maxDepth) {
            throw new CoordinationException(ErrorKind.DEPTH_EXCEEDED,
                    "Delegation to '" + target.roleId() + "' would reach depth " + depth
                            + " (max " + maxDepth + ")");
        }
        return target;
    }

    private static Collection<OperationKind> requestedKinds(RoleDefinition target, DelegationRequest request) {
        return request.requestedCapabilities() != null
                ? request.requestedCapabilities()
                : target.capabilities().kinds();
    }

    static String normalize(String task) {
        return task == null ? "" : task.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private Instant childDeadline(TaskContext parent, Duration requested) {
        Instant own = deadlineAfter(requested != null ? requested : defaultTimeout);
        Instant inherited = parent.deadline();
        if (own == null) {
            return inherited;
        }
        return inherited != null && inherited.isBefore(own) ? inherited : own;
    }

    /** Now plus {@code timeout}, saturating at {@link Instant#MAX}; null for no timeout. */
    static Instant deadlineAfter(Duration timeout) {
        if (timeout == null) {
            return null;
        }
        Instant now = Instant.now();
        return timeout.compareTo(Duration.between(now, Instant.MAX)) >= 0 ? Instant.MAX : now.plus(timeout);
    }

    private List<String> chainThrough(TaskContext parent, String targetRoleId) {
        List<String> chain = new ArrayList<>(parent.tree().chain(parent));
        chain.add(targetRoleId);
        return chain;
    }

    private Outcome await(TaskContext child) {
        try {
            return child.completion().get();
        } catch (InterruptedException e) {
            // the waiting parent is being torn down; take the child with it
            cancel(child);
            Outcome outcome = child.completion().join();
            Thread.currentThread().interrupt();
            return outcome;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Task completion failed for " + child, e.getCause());
        }
    }

    // ------------------------------------------------------------------
    // Cancellation and deadlines
    // ------------------------------------------------------------------

    /** Cancel {@code ctx} and everything below it; descendants resolve first. */
    public void cancel(TaskContext ctx) {
        terminate(ctx, ErrorKind.CANCELLED, "Task was cancelled");
    }

    void expire(TaskContext ctx) {
        log.warn("Task {} ({}) passed its deadline {}", ctx.id(), ctx.roleId(), ctx.deadline());
        terminate(ctx, ErrorKind.TIMEOUT, "Deadline " + ctx.deadline() + " passed");
    }

    private void terminate(TaskContext ctx, ErrorKind kind, String message) {
        if (ctx.status().isTerminal()) {
            return;
        }
        TaskTree tree = ctx.tree();
        for (TaskContext victim : tree.markSubtreeCancelled(ctx)) {
            ErrorKind victimKind = victim == ctx ? kind : ErrorKind.CANCELLED;
            String victimMessage = victim == ctx ? message : "Ancestor task was stopped: " + message;
            aggregator.resolve(victim, Outcome.failed(victim.roleId(),
                    new TaskFailure(victimKind, victimMessage, tree.chain(victim))));
            tree.locked(() -> {
                victim.interruptWorker();
                return null;
            });
        }
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    private void launch(TaskContext ctx) {
        Future<?> worker = pool.submit(() -> execute(ctx));
        ScheduledFuture<?> timer = ctx.deadline() == null ? null
                : pool.schedule(() -> expire(ctx), Duration.between(Instant.now(), ctx.deadline()));
        ctx.tree().locked(() -> {
            ctx.attachWorker(worker);
            if (timer != null) {
                ctx.attachDeadlineTimer(timer);
            }
            if (ctx.status().isTerminal()) {
                ctx.stopDeadlineTimer();
                if (ctx.isCancelled()) {
                    ctx.interruptWorker();
                }
            }
            return null;
        });
    }

    private void execute(TaskContext ctx) {
        MdcContext.setTask(ctx.rootTaskId(), ctx.id(), ctx.roleId(), ctx.depth());
        try {
            if (!ctx.tree().transition(ctx, TaskStatus.RUNNING)) {
                return;
            }
            log.debug("Running task {} for role '{}'", ctx.id(), ctx.roleId());
            aggregator.resolve(ctx, run(ctx));
        } finally {
            MdcContext.clear();
        }
    }

    /** Runs the role's behavior, re-running it for retryable tool failures. */
    private Outcome run(TaskContext ctx) {
        Optional<RoleBehavior> behavior = behaviors.find(ctx.roleId());
        if (behavior.isEmpty()) {
            return fail(ctx, ErrorKind.BEHAVIOR_UNAVAILABLE,
                    "No behavior registered for role '" + ctx.roleId() + "'");
        }
        TaskScope scope = new ContextTaskScope(ctx, this, gateway);

        while (true) {
            try {
                Object result = behavior.get().perform(scope);
                if (ctx.isCancelled()) {
                    return fail(ctx, ErrorKind.CANCELLED, "Task was cancelled");
                }
                return Outcome.succeeded(ctx.roleId(), result);
            } catch (ToolInvocationException e) {
                if (e.isRetryable() && ctx.attempt() < maxRetries && !ctx.isCancelled()) {
                    ctx.setAttempt(ctx.attempt() + 1);
                    metrics.recordRetry(ctx.roleId());
                    log.warn("Task {} ({}) attempt {}/{} after idempotent {} failure: {}",
                            ctx.id(), ctx.roleId(), ctx.attempt(), maxRetries, e.getOperation(), e.getDetail());
                    continue;
                }
                return fail(ctx, e);
            } catch (DelegationFailedException e) {
                return Outcome.failed(ctx.roleId(), e.getFailure());
            } catch (CoordinationException e) {
                return fail(ctx, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return fail(ctx, ErrorKind.CANCELLED, "Task was interrupted");
            } catch (Exception e) {
                if (ctx.isCancelled()) {
                    return fail(ctx, ErrorKind.CANCELLED, "Task was cancelled");
                }
                log.error("Behavior for role '{}' failed: {}", ctx.roleId(), e.getMessage(), e);
                return fail(ctx, ErrorKind.TOOL_INVOCATION_ERROR,
                        "Behavior for role '" + ctx.roleId() + "' failed: " + e.getMessage());
            }
        }
    }

    private Outcome fail(TaskContext ctx, CoordinationException e) {
        return Outcome.failed(ctx.roleId(), TaskFailure.of(e, ctx.tree().chain(ctx)));
    }

    private Outcome fail(TaskContext ctx, ErrorKind kind, String message) {
        return Outcome.failed(ctx.roleId(), new TaskFailure(kind, message, ctx.tree().chain(ctx)));
    }
}
