package com.gigpulse.service.cache;

import com.gigpulse.core.model.SlotForecast;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;
import java.util.logging.Logger;

public final class InMemoryForecastCache implements ForecastCache {
    private static final Logger LOGGER = Logger.getLogger(InMemoryForecastCache.class.getName());

    private final Clock clock;
    private final Duration ttl;
    private final int maxEntries;
    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<SlotForecast>> inFlight = new ConcurrentHashMap<>();
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder computations = new LongAdder();
    private final LongAdder sharedWaits = new LongAdder();
    private final LongAdder failures = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private volatile boolean closed;

    public InMemoryForecastCache(Clock clock, Duration ttl, int maxEntries) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1");
        }
        this.clock = clock;
        this.ttl = ttl;
        this.maxEntries = maxEntries;
    }

    @Override
    public SlotForecast getOrCompute(String key, Supplier<SlotForecast> compute) {
        ensureOpen();
        Optional<SlotForecast> live = peek(key);
        if (live.isPresent()) {
            hits.increment();
            return live.get();
        }
        misses.increment();

        CompletableFuture<SlotForecast> mine = new CompletableFuture<>();
        CompletableFuture<SlotForecast> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            sharedWaits.increment();
            return await(existing);
        }

        try {
            // another caller may have finished between our lookup and registration
            Optional<SlotForecast> justStored = peek(key);
            SlotForecast value;
            if (justStored.isPresent()) {
                value = justStored.get();
            } else {
                computations.increment();
                value = compute.get();
                store(key, value);
            }
            mine.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            failures.increment();
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    @Override
    public Optional<SlotForecast> peek(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isLive(clock.instant())) {
            return Optional.of(entry.value());
        }
        entries.remove(key, entry);
        return Optional.empty();
    }

    @Override
    public void clear() {
        entries.clear();
    }

    @Override
    public CacheStats stats() {
        return new CacheStats(
                hits.sum(),
                misses.sum(),
                computations.sum(),
                sharedWaits.sum(),
                failures.sum(),
                evictions.sum(),
                entries.size()
        );
    }

    public void close() {
        closed = true;
        entries.clear();
    }

    private void ensureOpen() {
        if (closed) {
            throw new CacheUnavailableException("Forecast cache is closed");
        }
    }

    private void store(String key, SlotForecast value) {
        Instant now = clock.instant();
        entries.put(key, new CacheEntry(key, value, now.plus(ttl)));
        if (entries.size() > maxEntries) {
            makeRoom(now);
        }
    }

    private void makeRoom(Instant now) {
        int before = entries.size();
        entries.values().removeIf(entry -> !entry.isLive(now));
        while (entries.size() > maxEntries) {
            Optional<CacheEntry> oldest = entries.values().stream().min(Comparator.comparing(CacheEntry::expiresAt));
            if (oldest.isEmpty()) {
                break;
            }
            entries.remove(oldest.get().key(), oldest.get());
        }
        int removed = before - entries.size();
        if (removed > 0) {
            evictions.add(removed);
            LOGGER.fine("Evicted " + removed + " forecast cache entries");
        }
    }

    private static SlotForecast await(CompletableFuture<SlotForecast> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }
}
