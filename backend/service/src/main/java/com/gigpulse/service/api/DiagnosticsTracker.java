package com.gigpulse.service.api;

import com.gigpulse.core.bus.EventBus;
import com.gigpulse.core.events.AlertRaised;
import com.gigpulse.core.events.Event;
import com.gigpulse.core.events.ForecastComputed;
import com.gigpulse.core.events.SignalFetched;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

public final class DiagnosticsTracker {
    private final Clock clock;
    private final LongAdder eventsEmittedTotal = new LongAdder();
    private final LongAdder forecastsComputed = new LongAdder();
    private final LongAdder liveForecasts = new LongAdder();
    private final AtomicLong lastForecastDurationMillis = new AtomicLong(-1);
    private final ArrayDeque<Instant> recentEventTimestamps = new ArrayDeque<>();
    private final Object recentLock = new Object();
    private final ConcurrentHashMap<String, SourceStatus> sourceStatuses = new ConcurrentHashMap<>();

    public DiagnosticsTracker(EventBus eventBus, Clock clock) {
        this(clock);
        eventBus.subscribeAll(this::onAnyEvent);
        eventBus.subscribe(SignalFetched.class, this::onSignalFetched);
        eventBus.subscribe(AlertRaised.class, this::onAlertRaised);
        eventBus.subscribe(ForecastComputed.class, this::onForecastComputed);
    }

    private DiagnosticsTracker(Clock clock) {
        this.clock = clock;
    }

    public static DiagnosticsTracker empty() {
        return new DiagnosticsTracker(Clock.systemUTC());
    }

    public Map<String, Object> metricsSnapshot() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("eventsEmittedTotal", eventsEmittedTotal.longValue());
        metrics.put("recentEventsPerMinute", recentEventsPerMinute());
        metrics.put("forecastsComputed", forecastsComputed.longValue());
        metrics.put("liveForecasts", liveForecasts.longValue());
        long lastDuration = lastForecastDurationMillis.get();
        metrics.put("lastForecastDurationMillis", lastDuration < 0 ? null : lastDuration);
        return metrics;
    }

    public Map<String, Object> sourcesSnapshot() {
        Map<String, Object> sources = new TreeMap<>();
        for (Map.Entry<String, SourceStatus> entry : sourceStatuses.entrySet()) {
            sources.put(entry.getKey(), entry.getValue().toMap());
        }
        return sources;
    }

    private void onAnyEvent(Event event) {
        eventsEmittedTotal.increment();
        Instant now = clock.instant();
        synchronized (recentLock) {
            recentEventTimestamps.addLast(now);
            trimOld(now);
        }
    }

    private int recentEventsPerMinute() {
        synchronized (recentLock) {
            trimOld(clock.instant());
            return recentEventTimestamps.size();
        }
    }

    private void trimOld(Instant now) {
        Instant threshold = now.minus(1, ChronoUnit.MINUTES);
        while (!recentEventTimestamps.isEmpty()) {
            Instant first = recentEventTimestamps.peekFirst();
            if (first != null && first.isBefore(threshold)) {
                recentEventTimestamps.removeFirst();
            } else {
                break;
            }
        }
    }

    private void onSignalFetched(SignalFetched event) {
        sourceStatuses.compute(event.source(), (name, current) -> {
            SourceStatus status = current == null ? SourceStatus.empty() : current;
            return status.withFetch(event);
        });
    }

    private void onAlertRaised(AlertRaised event) {
        if (!AlertRaised.CATEGORY_SCRAPER.equals(event.category()) || event.details() == null) {
            return;
        }
        Object source = event.details().get("source");
        if (!(source instanceof String sourceName) || sourceName.isBlank()) {
            return;
        }
        sourceStatuses.compute(sourceName, (name, current) -> {
            SourceStatus status = current == null ? SourceStatus.empty() : current;
            return status.withError(event.timestamp(), event.message());
        });
    }

    private void onForecastComputed(ForecastComputed event) {
        forecastsComputed.increment();
        if (event.usingLiveData()) {
            liveForecasts.increment();
        }
        lastForecastDurationMillis.set(event.durationMillis());
    }

    private record SourceStatus(
            long fetches,
            long degradedFetches,
            long memoizedFetches,
            Instant lastFetchedAt,
            String lastOrigin,
            Boolean lastDegraded,
            Long lastDurationMillis,
            Instant lastErrorAt,
            String lastErrorMessage
    ) {
        private static SourceStatus empty() {
            return new SourceStatus(0, 0, 0, null, null, null, null, null, null);
        }

        private SourceStatus withFetch(SignalFetched event) {
            return new SourceStatus(
                    fetches + 1,
                    degradedFetches + (event.degraded() ? 1 : 0),
                    memoizedFetches + (event.memoized() ? 1 : 0),
                    event.timestamp(),
                    event.origin(),
                    event.degraded(),
                    event.durationMillis(),
                    lastErrorAt,
                    lastErrorMessage
            );
        }

        private SourceStatus withError(Instant at, String message) {
            return new SourceStatus(fetches, degradedFetches, memoizedFetches, lastFetchedAt, lastOrigin,
                    lastDegraded, lastDurationMillis, at, message);
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("fetches", fetches);
            map.put("degradedFetches", degradedFetches);
            map.put("memoizedFetches", memoizedFetches);
            map.put("lastFetchedAt", lastFetchedAt == null ? null : lastFetchedAt.toString());
            map.put("lastOrigin", lastOrigin);
            map.put("lastDegraded", lastDegraded);
            map.put("lastDurationMillis", lastDurationMillis);
            map.put("lastErrorAt", lastErrorAt == null ? null : lastErrorAt.toString());
            map.put("lastErrorMessage", lastErrorMessage);
            return map;
        }
    }
}
