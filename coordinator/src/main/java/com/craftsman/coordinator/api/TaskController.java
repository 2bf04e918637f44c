package com.craftsman.coordinator.api;

import com.craftsman.coordinator.api.dto.SubmitTaskRequest;
import com.craftsman.coordinator.api.dto.TaskOutcomeResponse;
import com.craftsman.coordinator.service.CoordinatorService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;

/**
 * REST entry point for root tasks.
 *
 * POST /tasks : run a task for a role and return its terminal outcome
 */
@RestController
@RequestMapping("/tasks")
public class TaskController {

    static final long MAX_TIMEOUT_SECONDS = Duration.ofDays(1).toSeconds();

    private final CoordinatorService coordinator;

    public TaskController(CoordinatorService coordinator) {
        this.coordinator = coordinator;
    }

    /**
     * Run a root task synchronously.
     *
     * A failed task is still 200: the body carries the typed failure.
     * Returns 400 if roleId or task is missing, or timeoutSeconds exceeds one day.
     *
     * Example:
     *   curl -X POST http://localhost:8080/tasks \
     *     -H "Content-Type: application/json" \
     *     -d '{"roleId":"coder","task":"find callers of parseConfig"}'
     */
    @PostMapping
    public TaskOutcomeResponse run(@RequestBody SubmitTaskRequest req) {
        if (req.roleId() == null || req.roleId().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "roleId is required");
        }
        if (req.task() == null || req.task().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "task is required");
        }
        if (req.timeoutSeconds() != null && req.timeoutSeconds() > MAX_TIMEOUT_SECONDS) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "timeoutSeconds must be at most " + MAX_TIMEOUT_SECONDS);
        }
        Duration timeout = req.timeoutSeconds() == null || req.timeoutSeconds() <= 0
                ? null
                : Duration.ofSeconds(req.timeoutSeconds());
        return TaskOutcomeResponse.from(coordinator.runRootTask(req.roleId(), req.task(), timeout));
    }
}
