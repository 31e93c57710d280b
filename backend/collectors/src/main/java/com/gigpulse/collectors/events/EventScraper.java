package com.gigpulse.collectors.events;

import com.gigpulse.collectors.api.AbstractScraper;
import com.gigpulse.collectors.api.ScrapeContext;
import com.gigpulse.collectors.api.ScrapeException;
import com.gigpulse.collectors.api.ScrapeRequest;
import com.gigpulse.collectors.config.ScraperSettings;
import com.gigpulse.collectors.http.TtlMemo;
import com.gigpulse.core.forecast.EventDemandTable;
import com.gigpulse.core.model.EventSignal;
import com.gigpulse.core.model.SignalSource;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.logging.Logger;

public class EventScraper extends AbstractScraper<EventSignal> {
    private static final Logger LOGGER = Logger.getLogger(EventScraper.class.getName());

    private final List<EventIndex> indexes;
    private final EventDemandTable demandTable;
    private final EventBoostCalculator boostCalculator = new EventBoostCalculator();
    // one listing per location and day serves every hour of that day
    private final TtlMemo<Listing> listings;
    private final ConcurrentHashMap<String, CompletableFuture<Listing>> listingsInFlight = new ConcurrentHashMap<>();

    public EventScraper(ScraperSettings settings, List<EventIndex> indexes, EventDemandTable demandTable) {
        super(settings);
        this.indexes = List.copyOf(indexes);
        this.demandTable = demandTable;
        this.listings = new TtlMemo<>(Duration.ofSeconds(settings.ttlSeconds()));
    }

    @Override
    public SignalSource source() {
        return SignalSource.EVENTS;
    }

    @Override
    public EventSignal fallback(ScrapeRequest request) {
        return EventSignal.unavailable();
    }

    @Override
    protected boolean isConfigured() {
        return indexes.stream().anyMatch(EventIndex::isConfigured);
    }

    @Override
    protected String memoKey(ScrapeRequest request) {
        return request.location().key() + "|" + request.slot().date() + "|" + request.hour();
    }

    @Override
    protected EventSignal load(ScrapeContext ctx, ScrapeRequest request) throws IOException, InterruptedException {
        LocalDate date = request.slot().date();
        Listing listing = listingFor(ctx, request, date);
        List<ListedEvent> events = listing.events();
        return new EventSignal(
                events.size(),
                demandTable.multiplierFor(events.size()),
                boostCalculator.boostAt(events, date.atTime(request.hour(), 0)),
                listing.origin(),
                false
        );
    }

    private Listing listingFor(ScrapeContext ctx, ScrapeRequest request, LocalDate date)
            throws IOException, InterruptedException {
        String listingKey = request.location().key() + "|" + date;
        Optional<Listing> memoized = listings.get(listingKey, ctx.clock().instant());
        if (memoized.isPresent()) {
            return memoized.get();
        }

        CompletableFuture<Listing> mine = new CompletableFuture<>();
        CompletableFuture<Listing> existing = listingsInFlight.putIfAbsent(listingKey, mine);
        if (existing != null) {
            return await(existing);
        }
        try {
            Listing listing = listings.get(listingKey, ctx.clock().instant()).orElse(null);
            if (listing == null) {
                listing = fetchListing(ctx, request, date);
                listings.put(listingKey, listing, ctx.clock().instant());
            }
            mine.complete(listing);
            return listing;
        } catch (IOException | InterruptedException | RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            listingsInFlight.remove(listingKey, mine);
        }
    }

    private static Listing await(CompletableFuture<Listing> future) throws IOException, InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new ScrapeException("Shared event listing fetch failed", cause);
        }
    }

    private Listing fetchListing(ScrapeContext ctx, ScrapeRequest request, LocalDate date)
            throws IOException, InterruptedException {
        List<String> failures = new ArrayList<>();
        for (EventIndex index : indexes) {
            if (!index.isConfigured()) {
                continue;
            }
            try {
                return new Listing(index.name(), onDate(index.eventsOn(ctx, request.location(), date), date));
            } catch (IOException | ScrapeException e) {
                LOGGER.info("Event index " + index.name() + " failed, trying next: " + rootMessage(e));
                failures.add(index.name() + ": " + rootMessage(e));
            }
        }
        throw new ScrapeException("No event index answered (" + String.join("; ", failures) + ")");
    }

    static List<ListedEvent> onDate(List<ListedEvent> events, LocalDate date) {
        Map<String, ListedEvent> unique = new LinkedHashMap<>();
        for (ListedEvent event : events) {
            if (event.date().equals(date)) {
                unique.putIfAbsent(event.id(), event);
            }
        }
        return new ArrayList<>(unique.values());
    }

    private record Listing(String origin, List<ListedEvent> events) {
    }
}
