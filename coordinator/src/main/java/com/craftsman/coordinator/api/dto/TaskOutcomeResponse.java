package com.craftsman.coordinator.api.dto;

import com.craftsman.coordinator.model.Outcome;
import com.craftsman.coordinator.tool.ToolInvocationRecord;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Response body for POST /tasks: the terminal outcome, with the whole
 * delegation tree under {@code children}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskOutcomeResponse(
        String                     status,
        String                     roleId,
        Object                     result,
        String                     errorKind,
        String                     errorMessage,
        List<String>               delegationChain,
        List<ToolInvocationRecord> audit,
        List<TaskOutcomeResponse>  children
) {
    public static TaskOutcomeResponse from(Outcome o) {
        return new TaskOutcomeResponse(
                o.status().name(),
                o.roleId(),
                o.result(),
                o.failure() == null ? null : o.failure().kind().name(),
                o.failure() == null ? null : o.failure().message(),
                o.failure() == null ? null : o.failure().delegationChain(),
                o.audit(),
                o.children().stream().map(TaskOutcomeResponse::from).toList()
        );
    }
}
