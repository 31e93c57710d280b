package com.gigpulse.collectors.api;

import com.gigpulse.core.model.Signal;
import com.gigpulse.core.model.SignalSource;

import java.util.concurrent.CompletableFuture;

public interface Scraper<S extends Signal> {
    SignalSource source();

    // never completes exceptionally; a failed or timed out fetch yields fallback(request)
    CompletableFuture<S> fetch(ScrapeContext ctx, ScrapeRequest request);

    S fallback(ScrapeRequest request);
}
