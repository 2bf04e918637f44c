package com.craftsman.coordinator.service;

import com.craftsman.coordinator.config.CoordinatorProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Threads that run role behaviors, plus the deadline timer.
 *
 * Threads are cached; how many behaviors actually run at once is capped by
 * a semaphore of {@code maxConcurrency} permits. A parent waiting on its
 * children gives its permit back for the duration ({@link #suspend}), so a
 * deep delegation chain cannot starve the pool.
 */
@Component
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final ExecutorService             workers = Executors.newCachedThreadPool(named("craftsman-worker"));
    private final ScheduledThreadPoolExecutor timers  = deadlineTimers();
    private final Semaphore                   permits;
    private final ThreadLocal<Boolean>        holdsPermit = ThreadLocal.withInitial(() -> false);

    @Autowired
    public WorkerPool(CoordinatorProperties properties) {
        this(properties.getMaxConcurrency());
    }

    public WorkerPool(int maxConcurrency) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1, got " + maxConcurrency);
        }
        this.permits = new Semaphore(maxConcurrency, true);
    }

    private static ScheduledThreadPoolExecutor deadlineTimers() {
        ScheduledThreadPoolExecutor timers = new ScheduledThreadPoolExecutor(1, named("craftsman-deadline"));
        // cancelled timers leave the queue at once and release their task tree
        timers.setRemoveOnCancelPolicy(true);
        return timers;
    }

    /**
     * Run {@code work} on a worker once a permit is free.
     * The returned future is only used to interrupt the worker on cancel.
     */
    public Future<?> submit(Runnable work) {
        return workers.submit(() -> {
            try {
                permits.acquire();
            } catch (InterruptedException e) {
                // cancelled while queued; the canceller already resolved the task
                log.debug("Worker interrupted while waiting for a permit");
                return;
            }
            holdsPermit.set(true);
            try {
                work.run();
            } catch (RuntimeException e) {
                log.error("Unhandled error in worker: {}", e.getMessage(), e);
            } finally {
                holdsPermit.set(false);
                permits.release();
            }
        });
    }

    /**
     * Run a blocking wait with this thread's permit released, re-acquiring it
     * afterwards. Threads that hold no permit just run the wait.
     */
    public <T> T suspend(Supplier<T> wait) {
        if (!holdsPermit.get()) {
            return wait.get();
        }
        permits.release();
        holdsPermit.set(false);
        try {
            return wait.get();
        } finally {
            permits.acquireUninterruptibly();
            holdsPermit.set(true);
        }
    }

    public ScheduledFuture<?> schedule(Runnable action, Duration delay) {
        long millis;
        try {
            millis = Math.max(0, delay.toMillis());
        } catch (ArithmeticException e) {
            millis = Long.MAX_VALUE;
        }
        return timers.schedule(action, millis, TimeUnit.MILLISECONDS);
    }

    int pendingTimers() {
        return timers.getQueue().size();
    }

    public int availablePermits() {
        return permits.availablePermits();
    }

    @PreDestroy
    public void shutdown() {
        timers.shutdownNow();
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
