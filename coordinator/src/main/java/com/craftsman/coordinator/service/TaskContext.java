package com.craftsman.coordinator.service;

import com.craftsman.coordinator.model.Outcome;
import com.craftsman.coordinator.model.TaskStatus;
import com.craftsman.coordinator.role.CapabilitySet;
import com.craftsman.coordinator.role.RoleDefinition;
import com.craftsman.coordinator.tool.ToolInvocationRecord;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One running unit of work bound to a role.
 *
 * Contexts live in a {@link TaskTree} and refer to their parent by id only.
 * Status and worker handles are guarded by the tree lock and
 * mutated only by the router and the aggregator. The invocation lock,
 * audit trail and step counter belong to the gateway.
 */
public final class TaskContext {

    private final TaskTree       tree;
    private final long           id;
    private final Long           parentId;
    private final RoleDefinition role;
    private final String         task;
    private final int            depth;
    private final CapabilitySet  grant;
    private final Instant        deadline;

    private final CompletableFuture<Outcome>  completion     = new CompletableFuture<>();
    private final ReentrantLock               invocationLock = new ReentrantLock();
    private final List<ToolInvocationRecord>  audit          = new CopyOnWriteArrayList<>();
    private final List<Outcome>               childOutcomes  = new CopyOnWriteArrayList<>();

    private volatile TaskStatus status = TaskStatus.PENDING;
    private volatile boolean    cancelled;
    private volatile int        attempt;

    // guarded by invocationLock
    private int stepsUsed;

    // guarded by tree lock
    private Future<?>          worker;
    private ScheduledFuture<?> deadlineTimer;

    TaskContext(TaskTree tree, long id, Long parentId, RoleDefinition role, String task,
                int depth, CapabilitySet grant, Instant deadline) {
        this.tree     = tree;
        this.id       = id;
        this.parentId = parentId;
        this.role     = role;
        this.task     = task == null ? "" : task;
        this.depth    = depth;
        this.grant    = grant;
        this.deadline = deadline;
    }

    // ------------------------------------------------------------------
    // Read side
    // ------------------------------------------------------------------

    public long           id()          { return id; }
    public Long           parentId()    { return parentId; }
    public String         rootTaskId()  { return tree.rootTaskId(); }
    public String         roleId()      { return role.roleId(); }
    public RoleDefinition role()        { return role; }
    public String         task()        { return task; }
    public int            depth()       { return depth; }
    /** Capabilities of this context: the role's set, narrowed by every delegation above it. */
    public CapabilitySet  grant()       { return grant; }
    public Instant        deadline()    { return deadline; }
    public TaskStatus     status()      { return status; }
    public boolean        isCancelled() { return cancelled; }
    public int            attempt()     { return attempt; }
    public boolean        isRoot()      { return parentId == null; }

    /** Outcomes of this context's delegations consumed so far, in request order. */
    public List<Outcome> childOutcomes() { return List.copyOf(childOutcomes); }

    public List<ToolInvocationRecord> auditTrail() { return List.copyOf(audit); }

    // ------------------------------------------------------------------
    // Gateway side
    // ------------------------------------------------------------------

    /** Held by the gateway across the capability check and the collaborator call. */
    public ReentrantLock invocationLock() { return invocationLock; }

    public void recordInvocation(ToolInvocationRecord record) { audit.add(record); }

    public int stepsUsed() { return stepsUsed; }

    public void incrementSteps() { stepsUsed++; }

    // ------------------------------------------------------------------
    // Router / aggregator side
    // ------------------------------------------------------------------

    TaskTree tree() { return tree; }

    CompletableFuture<Outcome> completion() { return completion; }

    void setStatus(TaskStatus next) { this.status = next; }

    void markCancelled() { this.cancelled = true; }

    void setAttempt(int attempt) { this.attempt = attempt; }

    void appendChildOutcomes(List<Outcome> outcomes) { childOutcomes.addAll(outcomes); }

    void attachWorker(Future<?> worker) { this.worker = worker; }

    void attachDeadlineTimer(ScheduledFuture<?> timer) { this.deadlineTimer = timer; }

    void stopDeadlineTimer() {
        if (deadlineTimer != null) {
            deadlineTimer.cancel(false);
        }
    }

    void interruptWorker() {
        if (worker != null) {
            worker.cancel(true);
        }
    }

    @Override
    public String toString() {
        return "TaskContext[" + id + " " + role.roleId() + " depth=" + depth + " " + status + "]";
    }
}
