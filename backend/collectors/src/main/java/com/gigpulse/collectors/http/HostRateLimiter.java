package com.gigpulse.collectors.http;

import com.gigpulse.collectors.api.ScrapeException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

public class HostRateLimiter {
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Clock clock;
    private final Sleeper sleeper;
    private final Map<String, Duration> minDelays = new ConcurrentHashMap<>();
    private final Map<String, Instant> nextFree = new ConcurrentHashMap<>();

    public HostRateLimiter(Clock clock) {
        this(clock, duration -> Thread.sleep(duration.toMillis()));
    }

    public HostRateLimiter(Clock clock, Sleeper sleeper) {
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public void configure(String host, Duration minDelay) {
        if (minDelay.isNegative()) {
            throw new IllegalArgumentException("minDelay must not be negative for " + host);
        }
        minDelays.put(host, minDelay);
    }

    public Duration minDelay(String host) {
        return minDelays.getOrDefault(host, Duration.ZERO);
    }

    public void acquire(String host) throws InterruptedException {
        acquire(host, null);
    }

    // a slot past the deadline is never reserved and the caller fails without sleeping
    public void acquire(String host, Instant deadline) throws InterruptedException {
        Duration delay = minDelay(host);
        if (delay.isZero()) {
            return;
        }
        Instant now = clock.instant();
        AtomicReference<Instant> reserved = new AtomicReference<>();
        nextFree.compute(host, (ignored, next) -> {
            Instant start = next == null || next.isBefore(now) ? now : next;
            if (deadline != null && !start.isBefore(deadline)) {
                return next;
            }
            reserved.set(start);
            return start.plus(delay);
        });

        Instant slot = reserved.get();
        if (slot == null) {
            throw new ScrapeException("Rate limit for " + host + " leaves no slot before the call deadline");
        }
        Duration wait = Duration.between(now, slot);
        if (!wait.isNegative() && !wait.isZero()) {
            sleeper.sleep(wait);
        }
    }
}
