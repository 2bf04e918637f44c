package com.craftsman.coordinator.model;

import com.craftsman.coordinator.tool.ToolInvocationRecord;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Terminal result of one TaskContext, as seen by its parent or by the
 * external caller.
 *
 * A failed Outcome is an ordinary value: the parent decides whether to
 * retry with another role, narrow the task, or propagate it with
 * {@link #orThrow()}.
 *
 * @param status    SUCCEEDED or FAILED
 * @param roleId    role that produced it
 * @param result    behavior's return value (null on failure)
 * @param failure   typed failure (null on success)
 * @param audit     tool invocations made by this context, granted or denied
 * @param children  outcomes of this context's delegations, in request order
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Outcome(
        TaskStatus                 status,
        String                     roleId,
        Object                     result,
        TaskFailure                failure,
        List<ToolInvocationRecord> audit,
        List<Outcome>              children) {

    public Outcome {
        if (status != TaskStatus.SUCCEEDED && status != TaskStatus.FAILED) {
            throw new IllegalArgumentException("Outcome status must be terminal: " + status);
        }
        audit    = audit == null ? List.of() : List.copyOf(audit);
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static Outcome succeeded(String roleId, Object result) {
        return new Outcome(TaskStatus.SUCCEEDED, roleId, result, null, List.of(), List.of());
    }

    public static Outcome failed(String roleId, TaskFailure failure) {
        return new Outcome(TaskStatus.FAILED, roleId, null, failure, List.of(), List.of());
    }

    public Outcome withTrail(List<ToolInvocationRecord> audit, List<Outcome> children) {
        return new Outcome(status, roleId, result, failure, audit, children);
    }

    @JsonIgnore
    public boolean isSucceeded() { return status == TaskStatus.SUCCEEDED; }

    @JsonIgnore
    public boolean isFailedWith(ErrorKind kind) {
        return failure != null && failure.kind() == kind;
    }

    /**
     * Return the result, or re-raise this outcome's failure so the calling
     * behavior fails with the same kind and chain.
     */
    public Object orThrow() {
        if (isSucceeded()) {
            return result;
        }
        throw new DelegationFailedException(failure);
    }
}
