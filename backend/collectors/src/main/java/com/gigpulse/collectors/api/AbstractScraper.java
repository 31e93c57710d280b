package com.gigpulse.collectors.api;

import com.gigpulse.collectors.config.ScraperSettings;
import com.gigpulse.collectors.http.TtlMemo;
import com.gigpulse.core.events.AlertRaised;
import com.gigpulse.core.events.SignalFetched;
import com.gigpulse.core.model.Signal;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

public abstract class AbstractScraper<S extends Signal> implements Scraper<S> {
    private static final Logger LOGGER = Logger.getLogger(AbstractScraper.class.getName());

    protected final ScraperSettings settings;
    private final TtlMemo<S> memo;

    protected AbstractScraper(ScraperSettings settings) {
        this.settings = settings;
        this.memo = new TtlMemo<>(Duration.ofSeconds(settings.ttlSeconds()));
    }

    protected abstract S load(ScrapeContext ctx, ScrapeRequest request) throws IOException, InterruptedException;

    protected abstract String memoKey(ScrapeRequest request);

    protected boolean isConfigured() {
        return true;
    }

    public ScraperSettings settings() {
        return settings;
    }

    @Override
    public CompletableFuture<S> fetch(ScrapeContext ctx, ScrapeRequest request) {
        Instant startedAt = ctx.clock().instant();
        if (!settings.enabled()) {
            S fallback = fallback(request);
            publishFetched(ctx, request, fallback, false, 0);
            return CompletableFuture.completedFuture(fallback);
        }
        if (!isConfigured()) {
            return CompletableFuture.completedFuture(degrade(
                    ctx, request, startedAt, new ScrapeException(source().wireName() + " source is not configured")));
        }

        String key = memoKey(request);
        Optional<S> memoized = memo.get(key, startedAt);
        if (memoized.isPresent()) {
            publishFetched(ctx, request, memoized.get(), true, 0);
            return CompletableFuture.completedFuture(memoized.get());
        }

        ScrapeContext call = ctx.withDeadline(startedAt.plusMillis(settings.timeoutMillis()));
        return CompletableFuture.supplyAsync(() -> loadUnchecked(call, request), ctx.executor())
                .orTimeout(settings.timeoutMillis(), TimeUnit.MILLISECONDS)
                .handle((signal, error) -> {
                    if (error != null) {
                        return degrade(ctx, request, startedAt, error);
                    }
                    memo.put(key, signal, ctx.clock().instant());
                    publishFetched(ctx, request, signal, false, elapsedMillis(ctx, startedAt));
                    return signal;
                });
    }

    private S loadUnchecked(ScrapeContext ctx, ScrapeRequest request) {
        try {
            return load(ctx, request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScrapeException("Interrupted while fetching " + source().wireName(), e);
        } catch (IOException e) {
            throw new ScrapeException(source().wireName() + " request failed", e);
        }
    }

    private S degrade(ScrapeContext ctx, ScrapeRequest request, Instant startedAt, Throwable error) {
        String message = describe(error);
        LOGGER.log(Level.WARNING, "Using default " + source().wireName() + " signal for "
                + request.location().key() + " " + request.slot() + ": " + message);
        ctx.eventBus().publish(new AlertRaised(
                ctx.clock().instant(),
                AlertRaised.CATEGORY_SCRAPER,
                source().wireName() + " fetch failed: " + message,
                Map.of("source", source().wireName(), "location", request.location().key().value())
        ));
        S fallback = fallback(request);
        publishFetched(ctx, request, fallback, false, elapsedMillis(ctx, startedAt));
        return fallback;
    }

    private void publishFetched(ScrapeContext ctx, ScrapeRequest request, S signal, boolean memoized, long durationMillis) {
        ctx.eventBus().publish(new SignalFetched(
                ctx.clock().instant(),
                source().wireName(),
                request.location().key().value(),
                signal.origin(),
                signal.degraded(),
                memoized,
                durationMillis
        ));
    }

    private String describe(Throwable error) {
        Throwable unwrapped = error;
        while (unwrapped instanceof java.util.concurrent.CompletionException && unwrapped.getCause() != null) {
            unwrapped = unwrapped.getCause();
        }
        if (unwrapped instanceof TimeoutException) {
            return "timed out after " + settings.timeoutMillis() + " ms";
        }
        if (unwrapped instanceof ScrapeException && unwrapped.getCause() == null) {
            return unwrapped.getMessage();
        }
        return rootMessage(unwrapped);
    }

    private static long elapsedMillis(ScrapeContext ctx, Instant startedAt) {
        return Duration.between(startedAt, ctx.clock().instant()).toMillis();
    }

    protected static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
