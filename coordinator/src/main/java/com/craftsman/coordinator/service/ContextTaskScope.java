package com.craftsman.coordinator.service;

import com.craftsman.coordinator.agent.TaskScope;
import com.craftsman.coordinator.model.Outcome;
import com.craftsman.coordinator.role.CapabilitySet;
import com.craftsman.coordinator.tool.OperationKind;
import com.craftsman.coordinator.tool.ToolGateway;

import java.util.List;
import java.util.Map;

/** {@link TaskScope} backed by a live TaskContext. */
final class ContextTaskScope implements TaskScope {

    private final TaskContext      ctx;
    private final DelegationRouter router;
    private final ToolGateway      gateway;

    ContextTaskScope(TaskContext ctx, DelegationRouter router, ToolGateway gateway) {
        this.ctx     = ctx;
        this.router  = router;
        this.gateway = gateway;
    }

    TaskContext context() { return ctx; }

    @Override public String        task()         { return ctx.task(); }
    @Override public String        roleId()       { return ctx.roleId(); }
    @Override public String        persona()      { return ctx.role().configBlob(); }
    @Override public int           depth()        { return ctx.depth(); }
    @Override public CapabilitySet capabilities() { return ctx.grant(); }
    @Override public boolean       isCancelled()  { return ctx.isCancelled(); }

    @Override
    public Object invoke(OperationKind kind, Map<String, Object> args) {
        return gateway.invoke(ctx, kind, args);
    }

    @Override
    public Outcome delegate(String targetRoleId, String task) {
        return router.delegate(ctx, DelegationRequest.to(targetRoleId, task));
    }

    @Override
    public Outcome delegate(DelegationRequest request) {
        return router.delegate(ctx, request);
    }

    @Override
    public List<Outcome> delegateAll(List<DelegationRequest> requests) {
        return router.delegateAll(ctx, requests);
    }

    @Override
    public List<Outcome> aggregatedView() {
        return ctx.childOutcomes();
    }
}
