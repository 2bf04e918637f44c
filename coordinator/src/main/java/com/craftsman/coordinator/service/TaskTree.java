package com.craftsman.coordinator.service;

import com.craftsman.coordinator.model.CoordinationException;
import com.craftsman.coordinator.model.ErrorKind;
import com.craftsman.coordinator.model.TaskStatus;
import com.craftsman.coordinator.role.CapabilitySet;
import com.craftsman.coordinator.role.RoleDefinition;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Arena holding every TaskContext of one root run.
 *
 * Contexts are stored flat, keyed by id, with parent links as ids; a single
 * lock guards structure and lifecycle state. One tree per root run, so
 * unrelated runs never contend.
 */
public final class TaskTree {

    private final String rootTaskId = UUID.randomUUID().toString();
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, TaskContext> nodes = new HashMap<>();
    private long nextId = 1;

    public String rootTaskId() { return rootTaskId; }

    public TaskContext createRoot(RoleDefinition role, String task, Instant deadline) {
        return locked(() -> {
            if (!nodes.isEmpty()) {
                throw new IllegalStateException("Tree " + rootTaskId + " already has a root");
            }
            return add(null, role, task, 0, role.capabilities(), deadline);
        });
    }

    /**
     * Add a child under {@code parent} and move the parent to DELEGATED.
     *
     * @throws CoordinationException CANCELLED if the parent was cancelled;
     *         checked under the tree lock, so a cancel sweep never misses a child
     */
    public TaskContext createChild(TaskContext parent, RoleDefinition role, String task,
                                   CapabilitySet grant, Instant deadline) {
        return locked(() -> {
            if (parent.isCancelled() || parent.status().isTerminal()) {
                throw new CoordinationException(ErrorKind.CANCELLED,
                        "Parent task " + parent.roleId() + " is no longer running");
            }
            transition(parent, TaskStatus.DELEGATED);
            return add(parent.id(), role, task, parent.depth() + 1, grant, deadline);
        });
    }

    private TaskContext add(Long parentId, RoleDefinition role, String task, int depth,
                            CapabilitySet grant, Instant deadline) {
        TaskContext ctx = new TaskContext(this, nextId++, parentId, role, task, depth, grant, deadline);
        nodes.put(ctx.id(), ctx);
        return ctx;
    }

    /**
     * Move {@code ctx} to {@code next}.
     *
     * @return false if ctx is already terminal (a late transition is ignored)
     * @throws IllegalStateException for any other illegal transition
     */
    public boolean transition(TaskContext ctx, TaskStatus next) {
        return locked(() -> {
            TaskStatus current = ctx.status();
            if (current.isTerminal()) {
                return false;
            }
            if (!current.canTransitionTo(next)) {
                throw new IllegalStateException("Illegal transition " + current + " -> " + next + " for " + ctx);
            }
            ctx.setStatus(next);
            return true;
        });
    }

    public Optional<TaskContext> find(long id) {
        return locked(() -> Optional.ofNullable(nodes.get(id)));
    }

    /** Contexts from {@code ctx} up to the root, ctx first. Evicted ancestors end the walk. */
    public List<TaskContext> ancestry(TaskContext ctx) {
        return locked(() -> {
            List<TaskContext> out = new ArrayList<>();
            TaskContext cur = ctx;
            while (cur != null) {
                out.add(cur);
                cur = cur.parentId() == null ? null : nodes.get(cur.parentId());
            }
            return out;
        });
    }

    /** Role ids from the root down to {@code ctx}. */
    public List<String> chain(TaskContext ctx) {
        List<String> roles = new ArrayList<>();
        for (TaskContext c : ancestry(ctx)) {
            roles.add(c.roleId());
        }
        Collections.reverse(roles);
        return roles;
    }

    /**
     * {@code ctx} and every live descendant, deepest first, ctx last.
     * Marks all of them cancelled under the lock, so none can spawn further children.
     */
    List<TaskContext> markSubtreeCancelled(TaskContext ctx) {
        return locked(() -> {
            List<TaskContext> out = new ArrayList<>();
            collectPostOrder(ctx, out);
            out.forEach(TaskContext::markCancelled);
            return out;
        });
    }

    private void collectPostOrder(TaskContext ctx, List<TaskContext> out) {
        for (TaskContext c : childrenOf(ctx.id())) {
            collectPostOrder(c, out);
        }
        out.add(ctx);
    }

    private List<TaskContext> childrenOf(long id) {
        List<TaskContext> out = new ArrayList<>();
        for (TaskContext c : nodes.values()) {
            if (c.parentId() != null && c.parentId() == id) {
                out.add(c);
            }
        }
        out.sort((a, b) -> Long.compare(a.id(), b.id()));
        return out;
    }

    /** Drop {@code ctx} and its descendants once their outcome has been consumed. */
    public void evict(TaskContext ctx) {
        locked(() -> {
            List<TaskContext> doomed = new ArrayList<>();
            collectPostOrder(ctx, doomed);
            doomed.forEach(c -> nodes.remove(c.id()));
            return null;
        });
    }

    public int size() {
        return locked(nodes::size);
    }

    <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
