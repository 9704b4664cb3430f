package com.joinwatch.tracker.monitor.http;

import com.joinwatch.tracker.config.MonitorProperties;
import com.joinwatch.tracker.monitor.service.DeliveryRetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Account-wide pause for detector reads after rate limiting or repeated transient failures.
 * While closed every detector strategy yields no signal; it reopens on its own.
 */
@Component
public class RemoteCallGate {
    private static final Logger log = LoggerFactory.getLogger(RemoteCallGate.class);

    private final Clock clock;
    private final DeliveryRetryPolicy retryPolicy;
    private final Duration defaultRateLimitPause;
    private final Object lock = new Object();
    private Instant pausedUntil;
    private int consecutiveTransientFailures;

    public RemoteCallGate(Clock clock, DeliveryRetryPolicy retryPolicy, MonitorProperties properties) {
        this.clock = clock;
        this.retryPolicy = retryPolicy;
        this.defaultRateLimitPause = Duration.ofSeconds(properties.getDetector().getRateLimitBackoffSeconds());
    }

    public boolean isOpen() {
        synchronized (lock) {
            return pausedUntil == null || !pausedUntil.isAfter(clock.instant());
        }
    }

    public Instant pausedUntil() {
        synchronized (lock) {
            return isOpen() ? null : pausedUntil;
        }
    }

    public void onRateLimited(Duration retryAfter) {
        Duration pause = retryAfter == null || retryAfter.isZero() || retryAfter.isNegative()
            ? defaultRateLimitPause
            : retryAfter;
        pause(pause, "rate limited");
    }

    public void onTransientFailure() {
        int failures;
        synchronized (lock) {
            consecutiveTransientFailures++;
            failures = consecutiveTransientFailures;
        }
        pause(retryPolicy.backoffFor(failures), "transient failure #" + failures);
    }

    public void onSuccess() {
        synchronized (lock) {
            consecutiveTransientFailures = 0;
        }
    }

    private void pause(Duration duration, String reason) {
        synchronized (lock) {
            Instant candidate = clock.instant().plus(duration);
            if (pausedUntil == null || candidate.isAfter(pausedUntil)) {
                pausedUntil = candidate;
            }
            log.warn("Pausing detector reads until {} ({})", pausedUntil, reason);
        }
    }
}
