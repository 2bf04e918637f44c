package com.craftsman.coordinator.service;

import com.craftsman.coordinator.CanonicalRoles;
import com.craftsman.coordinator.agent.RoleBehavior;
import com.craftsman.coordinator.agent.RoleBehaviors;
import com.craftsman.coordinator.agent.TaskScope;
import com.craftsman.coordinator.metrics.CoordinatorMetrics;
import com.craftsman.coordinator.role.RoleDefinition;
import com.craftsman.coordinator.role.RoleRegistry;
import com.craftsman.coordinator.tool.ToolCatalog;
import com.craftsman.coordinator.tool.ToolGateway;
import com.craftsman.coordinator.tool.ToolOperation;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Hand-wired coordinator for service tests: canonical roles, scripted
 * behaviors and fake tool operations, no Spring context.
 */
final class TestCoordinator {

    interface Body {
        Object perform(TaskScope scope) throws Exception;
    }

    final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    final RoleRegistry        roles;
    final WorkerPool          pool;
    final ResultAggregator    aggregator;
    final DelegationRouter    router;
    final CoordinatorService  service;

    private TestCoordinator(Builder b) {
        CoordinatorMetrics metrics = new CoordinatorMetrics(meters);
        roles      = b.roles != null ? b.roles : CanonicalRoles.registry(b.extraRoles.toArray(new RoleDefinition[0]));
        pool       = new WorkerPool(b.maxConcurrency);
        aggregator = b.aggregator != null ? b.aggregator : new ResultAggregator(metrics);
        ToolGateway gateway = new ToolGateway(roles, new ToolCatalog(b.operations), List.of(), metrics);
        router  = new DelegationRouter(roles, new RoleBehaviors(b.behaviors), gateway, aggregator, pool, metrics,
                b.maxDepth, b.maxRetries, b.defaultTimeout);
        service = new CoordinatorService(roles, router);
    }

    static Builder builder() {
        return new Builder();
    }

    static RoleBehavior behavior(String roleId, Body body) {
        return new RoleBehavior() {
            @Override public String roleId() { return roleId; }
            @Override public Object perform(TaskScope scope) throws Exception { return body.perform(scope); }
        };
    }

    /** The live context behind a scope handed to a behavior. */
    static TaskContext contextOf(TaskScope scope) {
        return ((ContextTaskScope) scope).context();
    }

    void shutdown() {
        pool.shutdown();
    }

    static final class Builder {
        private final List<RoleBehavior>   behaviors  = new ArrayList<>();
        private final List<ToolOperation>  operations = new ArrayList<>();
        private final List<RoleDefinition> extraRoles = new ArrayList<>();
        private int              maxDepth       = 8;
        private int              maxRetries     = 0;
        private int              maxConcurrency = 4;
        private Duration         defaultTimeout;
        private ResultAggregator aggregator;
        private RoleRegistry     roles;

        Builder behavior(String roleId, Body body) {
            behaviors.add(TestCoordinator.behavior(roleId, body));
            return this;
        }

        Builder operation(ToolOperation op)      { operations.add(op); return this; }
        Builder role(RoleDefinition def)         { extraRoles.add(def); return this; }
        Builder maxDepth(int v)                  { maxDepth = v; return this; }
        Builder maxRetries(int v)                { maxRetries = v; return this; }
        Builder maxConcurrency(int v)            { maxConcurrency = v; return this; }
        Builder defaultTimeout(Duration v)       { defaultTimeout = v; return this; }
        Builder aggregator(ResultAggregator v)   { aggregator = v; return this; }
        Builder roles(RoleRegistry v)            { roles = v; return this; }

        TestCoordinator build() {
            return new TestCoordinator(this);
        }
    }
}
