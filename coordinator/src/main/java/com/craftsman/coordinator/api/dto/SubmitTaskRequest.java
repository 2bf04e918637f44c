package com.craftsman.coordinator.api.dto;

/**
 * Request body for POST /tasks.
 *
 * Required: roleId, task
 * Optional: timeoutSeconds; absent or non-positive uses the configured default,
 *           above one day is rejected.
 */
public record SubmitTaskRequest(String roleId, String task, Long timeoutSeconds) {}
