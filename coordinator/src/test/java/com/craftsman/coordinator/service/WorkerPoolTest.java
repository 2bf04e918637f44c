package com.craftsman.coordinator.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerPoolTest {

    WorkerPool pool = new WorkerPool(2);

    @AfterEach
    void tearDown() {
        pool.shutdown();
    }

    @Test
    void submit_neverRunsMoreThanMaxConcurrencyAtOnce() throws Exception {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(6);

        for (int i = 0; i < 6; i++) {
            pool.submit(() -> {
                peak.accumulateAndGet(running.incrementAndGet(), Math::max);
                try {
                    Thread.sleep(30);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                running.decrementAndGet();
                done.countDown();
            });
        }

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(peak.get()).isLessThanOrEqualTo(2);
    }

    @Test
    void suspend_releasesPermitWhileWaiting() throws Exception {
        CountDownLatch inside = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger permitsWhileSuspended = new AtomicInteger(-1);

        pool.submit(() -> pool.suspend(() -> {
            permitsWhileSuspended.set(pool.availablePermits());
            inside.countDown();
            try {
                return release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }));

        assertThat(inside.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(permitsWhileSuspended.get()).isEqualTo(2);
        release.countDown();
    }

    @Test
    void suspend_outsideWorker_justRunsTheWait() {
        assertThat(pool.suspend(() -> "value")).isEqualTo("value");
        assertThat(pool.availablePermits()).isEqualTo(2);
    }

    @Test
    void schedule_firesAfterDelay() throws Exception {
        CountDownLatch fired = new CountDownLatch(1);

        pool.schedule(fired::countDown, Duration.ofMillis(20));

        assertThat(fired.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void constructor_rejectsZeroConcurrency() {
        assertThatThrownBy(() -> new WorkerPool(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void schedule_cancelledTimer_leavesQueueImmediately() {
        ScheduledFuture<?> timer = pool.schedule(() -> { }, Duration.ofHours(1));
        assertThat(pool.pendingTimers()).isEqualTo(1);

        timer.cancel(false);

        assertThat(pool.pendingTimers()).isZero();
    }

    @Test
    void schedule_delayBeyondMillisRange_isAccepted() {
        ScheduledFuture<?> timer = pool.schedule(() -> { }, Duration.ofSeconds(Long.MAX_VALUE));

        assertThat(timer.isDone()).isFalse();
        timer.cancel(false);
    }
}
