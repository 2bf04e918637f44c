package com.craftsman.coordinator.tool;

import com.craftsman.coordinator.metrics.CoordinatorMetrics;
import com.craftsman.coordinator.model.CoordinationException;
import com.craftsman.coordinator.model.ErrorKind;
import com.craftsman.coordinator.role.RoleDefinition;
import com.craftsman.coordinator.role.RoleRegistry;
import com.craftsman.coordinator.service.TaskContext;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Single choke point between role behaviors and external tool collaborators.
 *
 * <p>Per invocation, in order:
 * <ol>
 *   <li>capability check against the role table and the context's grant,
 *       including the path scope; a denial never reaches the collaborator</li>
 *   <li>cancellation check</li>
 *   <li>step budget check ({@link RoleDefinition#maxSteps()})</li>
 *   <li>collaborator call, timed and counted</li>
 * </ol>
 * Every attempt, granted or denied, lands in the context's audit trail.
 *
 * The per-context invocation lock is held from the check to the return, so
 * a context's audit trail and step counter stay consistent when a behavior
 * calls the gateway from several threads.
 */
@Component
public class ToolGateway {

    private static final Logger log = LoggerFactory.getLogger(ToolGateway.class);

    private final RoleRegistry                 roles;
    private final ToolCatalog                  catalog;
    private final List<ToolInvocationListener> listeners;
    private final CoordinatorMetrics           metrics;

    public ToolGateway(RoleRegistry roles, ToolCatalog catalog,
                       List<ToolInvocationListener> listeners, CoordinatorMetrics metrics) {
        this.roles     = roles;
        this.catalog   = catalog;
        this.listeners = List.copyOf(listeners);
        this.metrics   = metrics;
    }

    /**
     * Invoke {@code kind} on behalf of {@code ctx}.
     *
     * @throws CapabilityDeniedException if the role or the context's grant does not permit it
     * @throws CoordinationException     CANCELLED or STEP_LIMIT_EXCEEDED
     * @throws ToolInvocationException   if the collaborator failed or none is bound;
     *                                   the collaborator's exception is the cause
     */
    public Object invoke(TaskContext ctx, OperationKind kind, Map<String, Object> args) {
        ToolCall call = new ToolCall(ctx.rootTaskId(), ctx.roleId(), kind, args);
        Instant  at   = Instant.now();

        ctx.invocationLock().lock();
        try {
            Optional<ToolOperation> operation = catalog.find(kind);
            String pathArgument = operation.map(op -> op.manifest().pathArgument()).orElse("path");
            String path = pathArgument == null ? null : call.stringArg(pathArgument);

            String denial = checkCapability(ctx, kind, path);
            if (denial != null) {
                CapabilityDeniedException e = new CapabilityDeniedException(kind, denial);
                reject(ctx, call, at, "denied", e);
                log.warn("Denied {} for role '{}': {}", kind, ctx.roleId(), denial);
                throw e;
            }
            if (ctx.isCancelled()) {
                CoordinationException e = new CoordinationException(ErrorKind.CANCELLED,
                        "Task was cancelled before " + kind + " could run");
                reject(ctx, call, at, "cancelled", e);
                throw e;
            }
            int maxSteps = ctx.role().maxSteps();
            if (ctx.stepsUsed() >= maxSteps) {
                CoordinationException e = new CoordinationException(ErrorKind.STEP_LIMIT_EXCEEDED,
                        "Role '" + ctx.roleId() + "' used all " + maxSteps + " steps");
                reject(ctx, call, at, "step_limit", e);
                throw e;
            }
            ctx.incrementSteps();

            if (operation.isEmpty()) {
                ToolInvocationException e = new ToolInvocationException(kind, false,
                        "No tool operation bound for " + kind, null);
                reject(ctx, call, at, "error", e);
                throw e;
            }
            return call(ctx, operation.get(), call, at);
        } finally {
            ctx.invocationLock().unlock();
        }
    }

    /** Null when permitted, otherwise the denial reason. */
    private String checkCapability(TaskContext ctx, OperationKind kind, String path) {
        RoleDefinition role = roles.lookup(ctx.roleId());
        if (!role.capabilities().contains(kind)) {
            return "Role '" + role.roleId() + "' does not hold " + kind;
        }
        if (!ctx.grant().contains(kind)) {
            return kind + " was not granted to this '" + role.roleId() + "' task by its delegator";
        }
        if (!role.capabilities().permits(kind, path)) {
            return "Path '" + path + "' is outside the " + kind + " scope of role '"
                    + role.roleId() + "' [" + role.capabilities().scopeOf(kind) + "]";
        }
        if (!ctx.grant().permits(kind, path)) {
            return "Path '" + path + "' is outside the delegated " + kind + " scope ["
                    + ctx.grant().scopeOf(kind) + "]";
        }
        return null;
    }

    private Object call(TaskContext ctx, ToolOperation operation, ToolCall call, Instant at) {
        ToolManifest manifest = operation.manifest();
        String op = manifest.kind().name();
        notify(l -> l.beforeInvoke(call));

        Timer.Sample sample = metrics.startTimer();
        String status = "success";
        try {
            Object result = operation.execute(call);
            ctx.recordInvocation(new ToolInvocationRecord(call.kind(), "success", null, at, elapsed(at)));
            notify(l -> l.afterInvoke(call, result));
            return result;
        } catch (Exception e) {
            status = "error";
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            ToolInvocationException wrapped = new ToolInvocationException(call.kind(), manifest.idempotent(),
                    op + " failed: " + e.getMessage(), e);
            ctx.recordInvocation(new ToolInvocationRecord(call.kind(), "error", e.getMessage(), at, elapsed(at)));
            notify(l -> l.onFailure(call, wrapped));
            log.warn("{} failed for role '{}' (idempotent={}): {}",
                    op, ctx.roleId(), manifest.idempotent(), e.getMessage());
            throw wrapped;
        } finally {
            metrics.recordToolCall(op, ctx.roleId(), status, sample);
        }
    }

    private void reject(TaskContext ctx, ToolCall call, Instant at, String status, CoordinationException e) {
        ctx.recordInvocation(new ToolInvocationRecord(call.kind(), status, e.getDetail(), at, 0));
        metrics.recordToolCall(call.kind().name(), ctx.roleId(), status, null);
        notify(l -> l.onFailure(call, e));
    }

    private void notify(Consumer<ToolInvocationListener> hook) {
        for (ToolInvocationListener listener : listeners) {
            try {
                hook.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Tool invocation listener {} failed: {}",
                        listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    private static long elapsed(Instant since) {
        return Duration.between(since, Instant.now()).toMillis();
    }
}
