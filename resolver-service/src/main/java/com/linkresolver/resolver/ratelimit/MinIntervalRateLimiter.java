package com.linkresolver.resolver.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Spaces outbound resolution attempts at least {@code minInterval} apart.
 *
 * <p>Each caller reserves the next free slot under the lock and then waits outside it,
 * so concurrent callers queue up without holding the lock while sleeping.
 */
@Slf4j
public class MinIntervalRateLimiter {

    private final long minIntervalMs;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ReentrantLock lock = new ReentrantLock();

    private long nextAllowedAtMs = Long.MIN_VALUE;

    public MinIntervalRateLimiter(Duration minInterval, Clock clock, Sleeper sleeper) {
        if (minInterval == null || minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must not be negative");
        }
        this.minIntervalMs = minInterval.toMillis();
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until the caller's slot is reached.
     *
     * @return how long the caller had to wait
     */
    public Duration acquire() throws InterruptedException {
        long waitMs;
        lock.lock();
        try {
            long now = clock.millis();
            long slot = Math.max(now, nextAllowedAtMs);
            nextAllowedAtMs = slot + minIntervalMs;
            waitMs = slot - now;
        } finally {
            lock.unlock();
        }

        Duration wait = Duration.ofMillis(waitMs);
        if (waitMs > 0) {
            log.debug("Rate limiting: waiting {}ms", waitMs);
            sleeper.sleep(wait);
        }
        return wait;
    }

    public Duration getMinInterval() {
        return Duration.ofMillis(minIntervalMs);
    }
}
