package com.craftsman.coordinator.service;

import com.craftsman.coordinator.metrics.CoordinatorMetrics;
import com.craftsman.coordinator.model.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Settles contexts and folds child outcomes back into their parents.
 *
 * The first resolution of a context wins: a behavior returning after its
 * context was cancelled or timed out is ignored.
 */
@Component
public class ResultAggregator {

    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    private final CoordinatorMetrics metrics;

    public ResultAggregator(CoordinatorMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Record {@code outcome} as the terminal result of {@code ctx} and wake
     * whoever is waiting on it. The recorded outcome carries ctx's audit
     * trail and the outcomes of its own delegations.
     *
     * @return false if ctx was already resolved
     */
    public boolean resolve(TaskContext ctx, Outcome outcome) {
        TaskTree tree = ctx.tree();
        Outcome full = tree.locked(() -> {
            if (ctx.status().isTerminal()) {
                return null;
            }
            Outcome settled = outcome.withTrail(ctx.auditTrail(), ctx.childOutcomes());
            ctx.setStatus(settled.status());
            ctx.stopDeadlineTimer();
            return settled;
        });
        if (full == null) {
            log.debug("Ignoring late outcome {} for {}", outcome.status(), ctx);
            return false;
        }

        if (full.isSucceeded()) {
            log.info("Task {} ({}) succeeded at depth {}", ctx.id(), ctx.roleId(), ctx.depth());
        } else {
            log.info("Task {} ({}) failed: {} {}", ctx.id(), ctx.roleId(),
                    full.failure().kind(), full.failure().message());
        }
        metrics.recordTask(ctx.roleId(), full.isSucceeded() ? "succeeded" : full.failure().kind().name().toLowerCase());
        ctx.completion().complete(full);
        return true;
    }

    /**
     * Fold the outcomes of a batch into {@code parent}'s aggregated view,
     * preserving request order, before the parent resumes.
     */
    public List<Outcome> resolveBatch(TaskContext parent, List<Outcome> outcomes) {
        List<Outcome> ordered = List.copyOf(outcomes);
        parent.tree().locked(() -> {
            parent.appendChildOutcomes(ordered);
            return null;
        });
        return ordered;
    }
}
