package com.joinwatch.tracker.monitor.service;

import com.joinwatch.tracker.config.MonitorProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Global token bucket for outbound notifications, refilled in fixed steps. Callers block on a
 * condition until the next refill instead of spinning.
 */
@Component
public class RateBudget {
    private final Clock clock;
    private final long capacity;
    private final long tokensPerRefill;
    private final Duration refillInterval;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition refilled = lock.newCondition();
    private long tokens;
    private Instant lastRefillAt;

    @Autowired
    public RateBudget(Clock clock, MonitorProperties properties) {
        this(
            clock,
            properties.getDispatch().getTokenCapacity(),
            properties.getDispatch().getTokensPerRefill(),
            Duration.ofMillis(properties.getDispatch().getRefillIntervalMs())
        );
    }

    RateBudget(Clock clock, long capacity, long tokensPerRefill, Duration refillInterval) {
        this.clock = clock;
        this.capacity = Math.max(1, capacity);
        this.tokensPerRefill = Math.max(1, tokensPerRefill);
        this.refillInterval = refillInterval;
        this.tokens = this.capacity;
        this.lastRefillAt = clock.instant();
    }

    /**
     * Takes one token, waiting at most {@code maxWait} for a refill.
     *
     * @return false when the wait ran out or the thread was interrupted
     */
    public boolean tryAcquire(Duration maxWait) {
        long remainingNanos = Math.max(0L, maxWait.toNanos());
        lock.lock();
        try {
            while (true) {
                refill();
                if (tokens > 0) {
                    tokens--;
                    return true;
                }
                if (remainingNanos <= 0L) {
                    return false;
                }
                long waitNanos = Math.min(remainingNanos, Math.max(1L, nanosUntilNextRefill()));
                long left = refilled.awaitNanos(waitNanos);
                remainingNanos -= waitNanos - Math.max(0L, left);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
    }

    public long availableTokens() {
        lock.lock();
        try {
            refill();
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    private void refill() {
        Instant now = clock.instant();
        long elapsedNanos = Duration.between(lastRefillAt, now).toNanos();
        long intervalNanos = refillInterval.toNanos();
        if (elapsedNanos < intervalNanos) {
            return;
        }
        long steps = elapsedNanos / intervalNanos;
        tokens = Math.min(capacity, tokens + steps * tokensPerRefill);
        lastRefillAt = lastRefillAt.plusNanos(steps * intervalNanos);
        refilled.signalAll();
    }

    private long nanosUntilNextRefill() {
        Instant next = lastRefillAt.plus(refillInterval);
        return TimeUnit.NANOSECONDS.convert(Duration.between(clock.instant(), next));
    }
}
