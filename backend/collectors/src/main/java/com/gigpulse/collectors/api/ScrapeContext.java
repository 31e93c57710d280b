package com.gigpulse.collectors.api;

import com.gigpulse.collectors.http.HostRateLimiter;
import com.gigpulse.core.bus.EventBus;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executor;

public record ScrapeContext(
        HttpClient httpClient,
        EventBus eventBus,
        Clock clock,
        Executor executor,
        HostRateLimiter rateLimiter,
        Instant deadline
) {
    public ScrapeContext {
        Objects.requireNonNull(httpClient, "httpClient is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(executor, "executor is required");
        Objects.requireNonNull(rateLimiter, "rateLimiter is required");
    }

    public ScrapeContext(HttpClient httpClient, EventBus eventBus, Clock clock, Executor executor, HostRateLimiter rateLimiter) {
        this(httpClient, eventBus, clock, executor, rateLimiter, null);
    }

    public ScrapeContext withDeadline(Instant callDeadline) {
        return new ScrapeContext(httpClient, eventBus, clock, executor, rateLimiter, callDeadline);
    }
}
