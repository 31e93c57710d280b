package com.gigpulse.service.forecast;

import com.gigpulse.collectors.api.ScrapeRequest;
import com.gigpulse.collectors.api.SignalGatherer;
import com.gigpulse.core.bus.EventBus;
import com.gigpulse.core.events.ForecastComputed;
import com.gigpulse.core.forecast.EarningsAggregator;
import com.gigpulse.core.location.LocationQuery;
import com.gigpulse.core.location.LocationResolver;
import com.gigpulse.core.model.EarningsEstimate;
import com.gigpulse.core.model.ResolvedLocation;
import com.gigpulse.core.model.SignalBundle;
import com.gigpulse.core.model.SlotForecast;
import com.gigpulse.core.model.TimeSlot;
import com.gigpulse.service.cache.CacheStats;
import com.gigpulse.service.cache.CacheUnavailableException;
import com.gigpulse.service.cache.ForecastCache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Logger;

public class ForecastService {
    private static final Logger LOGGER = Logger.getLogger(ForecastService.class.getName());

    private final LocationResolver resolver;
    private final SignalGatherer gatherer;
    private final EarningsAggregator aggregator;
    private final ForecastCache cache;
    private final EventBus eventBus;
    private final Clock clock;
    private final Executor slotExecutor;

    public ForecastService(
            LocationResolver resolver,
            SignalGatherer gatherer,
            EarningsAggregator aggregator,
            ForecastCache cache,
            EventBus eventBus,
            Clock clock,
            Executor slotExecutor
    ) {
        this.resolver = resolver;
        this.gatherer = gatherer;
        this.aggregator = aggregator;
        this.cache = cache;
        this.eventBus = eventBus;
        this.clock = clock;
        this.slotExecutor = slotExecutor;
    }

    public SlotForecast forecast(LocationQuery query, TimeSlot slot) {
        return forecast(resolver.resolve(query), slot);
    }

    public SlotForecast lightweight(LocationQuery query, TimeSlot slot) {
        ResolvedLocation location = resolver.resolve(query);
        return assemble(location, slot, SignalBundle.defaults(location, slot));
    }

    public List<SlotForecast> batch(LocationQuery query, LocalDate date, List<Integer> hours) {
        ResolvedLocation location = resolver.resolve(query);
        List<CompletableFuture<SlotForecast>> tasks = new ArrayList<>();
        for (int hour : hours) {
            TimeSlot slot = new TimeSlot(date, hour);
            tasks.add(CompletableFuture.supplyAsync(() -> forecast(location, slot), slotExecutor));
        }
        return tasks.stream().map(CompletableFuture::join).toList();
    }

    public Map<LocalDate, Map<Integer, SlotForecast>> week(
            LocationQuery query,
            LocalDate startDate,
            int days,
            int firstHour,
            int lastHour
    ) {
        ResolvedLocation location = resolver.resolve(query);
        Map<LocalDate, Map<Integer, CompletableFuture<SlotForecast>>> tasks = new LinkedHashMap<>();
        for (int day = 0; day < days; day++) {
            LocalDate date = startDate.plusDays(day);
            Map<Integer, CompletableFuture<SlotForecast>> hours = new LinkedHashMap<>();
            for (int hour = firstHour; hour <= lastHour; hour++) {
                TimeSlot slot = new TimeSlot(date, hour);
                hours.put(hour, CompletableFuture.supplyAsync(() -> forecast(location, slot), slotExecutor));
            }
            tasks.put(date, hours);
        }

        Map<LocalDate, Map<Integer, SlotForecast>> week = new LinkedHashMap<>();
        tasks.forEach((date, hours) -> {
            Map<Integer, SlotForecast> resolved = new LinkedHashMap<>();
            hours.forEach((hour, task) -> resolved.put(hour, task.join()));
            week.put(date, resolved);
        });
        return week;
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public void clearCache() {
        cache.clear();
    }

    private SlotForecast forecast(ResolvedLocation location, TimeSlot slot) {
        String key = ForecastCache.keyFor(location.key(), slot);
        try {
            return cache.getOrCompute(key, () -> compute(location, slot));
        } catch (CacheUnavailableException e) {
            LOGGER.warning("Forecast cache unavailable, computing directly: " + e.getMessage());
            return compute(location, slot);
        }
    }

    private SlotForecast compute(ResolvedLocation location, TimeSlot slot) {
        Instant startedAt = clock.instant();
        SignalBundle signals = gatherer.gather(new ScrapeRequest(location, slot));
        SlotForecast forecast = assemble(location, slot, signals);
        eventBus.publish(new ForecastComputed(
                clock.instant(),
                location.key().value(),
                slot.date(),
                slot.hour(),
                forecast.usingLiveData(),
                Duration.between(startedAt, clock.instant()).toMillis()
        ));
        return forecast;
    }

    private SlotForecast assemble(ResolvedLocation location, TimeSlot slot, SignalBundle signals) {
        List<EarningsEstimate> estimates = aggregator.estimate(location, slot, signals, aggregator.services());
        return new SlotForecast(
                location.key(),
                location.label(),
                slot,
                estimates,
                signals.liveSources(),
                signals.degradedSources(),
                location.fallback()
        );
    }
}
