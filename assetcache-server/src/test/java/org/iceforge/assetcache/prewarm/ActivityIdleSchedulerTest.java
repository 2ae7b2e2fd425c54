package org.iceforge.assetcache.prewarm;

import org.iceforge.assetcache.http.ForegroundActivity;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActivityIdleSchedulerTest {

    @Test
    void quietHost_isIdleImmediately() {
        ActivityIdleScheduler idle = new ActivityIdleScheduler(new ForegroundActivity(),
                Duration.ofMillis(100), Duration.ofMillis(10), Duration.ofSeconds(30));

        long start = System.nanoTime();
        idle.whenIdle().block(Duration.ofSeconds(5));

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    void busyHost_proceedsAfterMaxWait() {
        ForegroundActivity activity = new ForegroundActivity();
        activity.begin();
        ActivityIdleScheduler idle = new ActivityIdleScheduler(activity,
                Duration.ZERO, Duration.ofMillis(10), Duration.ofMillis(150));

        long start = System.nanoTime();
        idle.whenIdle().block(Duration.ofSeconds(5));

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(100));
    }

    @Test
    void hostBecomingQuiet_releasesWaiter() throws InterruptedException {
        ForegroundActivity activity = new ForegroundActivity();
        activity.begin();
        ActivityIdleScheduler idle = new ActivityIdleScheduler(activity,
                Duration.ZERO, Duration.ofMillis(10), Duration.ofSeconds(30));

        ScheduledExecutorService exec = Executors.newSingleThreadScheduledExecutor();
        try {
            exec.schedule(activity::end, 100, TimeUnit.MILLISECONDS);

            long start = System.nanoTime();
            idle.whenIdle().block(Duration.ofSeconds(10));

            assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(10));
            assertThat(activity.inFlight()).isZero();
        } finally {
            exec.shutdownNow();
            exec.awaitTermination(1, TimeUnit.SECONDS);
        }
    }

    @Test
    void nonPositivePollInterval_isRejected() {
        assertThatThrownBy(() -> new ActivityIdleScheduler(new ForegroundActivity(),
                Duration.ZERO, Duration.ZERO, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
