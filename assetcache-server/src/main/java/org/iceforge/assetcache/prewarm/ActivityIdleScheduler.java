package org.iceforge.assetcache.prewarm;

import org.iceforge.assetcache.http.ForegroundActivity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Objects;

/**
 * {@link IdleScheduler} driven by {@link ForegroundActivity}: idle means no foreground request in
 * flight and none finished within the quiet period. Waiting is capped by {@code maxWait} so a busy
 * application still gets its cache warmed eventually.
 */
public class ActivityIdleScheduler implements IdleScheduler {
    private static final Logger logger = LoggerFactory.getLogger(ActivityIdleScheduler.class);

    private final ForegroundActivity activity;
    private final Duration quietPeriod;
    private final Duration pollInterval;
    private final Duration maxWait;
    private final Scheduler timer;

    public ActivityIdleScheduler(ForegroundActivity activity, Duration quietPeriod, Duration pollInterval, Duration maxWait) {
        this(activity, quietPeriod, pollInterval, maxWait, Schedulers.parallel());
    }

    public ActivityIdleScheduler(ForegroundActivity activity, Duration quietPeriod, Duration pollInterval,
                                 Duration maxWait, Scheduler timer) {
        this.activity = Objects.requireNonNull(activity);
        this.quietPeriod = Objects.requireNonNull(quietPeriod);
        this.pollInterval = Objects.requireNonNull(pollInterval);
        this.maxWait = Objects.requireNonNull(maxWait);
        this.timer = Objects.requireNonNull(timer);
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
        }
    }

    @Override
    public Mono<Void> whenIdle() {
        long quietNanos = quietPeriod.toNanos();
        return Flux.interval(Duration.ZERO, pollInterval, timer)
                .filter(tick -> activity.isQuietFor(quietNanos))
                .next()
                .timeout(maxWait, Mono.fromRunnable(() ->
                        logger.debug("No idle window within {}, proceeding anyway", maxWait)), timer)
                .then();
    }
}
