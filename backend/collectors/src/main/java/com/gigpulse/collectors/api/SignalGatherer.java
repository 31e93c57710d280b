package com.gigpulse.collectors.api;

import com.gigpulse.core.model.EventSignal;
import com.gigpulse.core.model.FuelPriceSignal;
import com.gigpulse.core.model.PricingSignal;
import com.gigpulse.core.model.Signal;
import com.gigpulse.core.model.SignalBundle;
import com.gigpulse.core.model.TrafficSignal;
import com.gigpulse.core.model.WeatherSignal;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

public class SignalGatherer {
    private static final Logger LOGGER = Logger.getLogger(SignalGatherer.class.getName());

    private final ScrapeContext ctx;
    private final Scraper<EventSignal> events;
    private final Scraper<WeatherSignal> weather;
    private final Scraper<TrafficSignal> traffic;
    private final Scraper<FuelPriceSignal> fuel;
    private final Scraper<PricingSignal> pricing;

    public SignalGatherer(
            ScrapeContext ctx,
            Scraper<EventSignal> events,
            Scraper<WeatherSignal> weather,
            Scraper<TrafficSignal> traffic,
            Scraper<FuelPriceSignal> fuel,
            Scraper<PricingSignal> pricing
    ) {
        this.ctx = ctx;
        this.events = events;
        this.weather = weather;
        this.traffic = traffic;
        this.fuel = fuel;
        this.pricing = pricing;
    }

    public List<Scraper<? extends Signal>> scrapers() {
        return List.of(events, weather, traffic, fuel, pricing);
    }

    public CompletableFuture<SignalBundle> gatherAsync(ScrapeRequest request) {
        CompletableFuture<EventSignal> eventTask = guarded(events, request);
        CompletableFuture<WeatherSignal> weatherTask = guarded(weather, request);
        CompletableFuture<TrafficSignal> trafficTask = guarded(traffic, request);
        CompletableFuture<FuelPriceSignal> fuelTask = guarded(fuel, request);
        CompletableFuture<PricingSignal> pricingTask = guarded(pricing, request);

        return CompletableFuture.allOf(eventTask, weatherTask, trafficTask, fuelTask, pricingTask)
                .thenApply(ignored -> new SignalBundle(
                        eventTask.join(),
                        weatherTask.join(),
                        trafficTask.join(),
                        fuelTask.join(),
                        pricingTask.join()
                ));
    }

    public SignalBundle gather(ScrapeRequest request) {
        return gatherAsync(request).join();
    }

    // a scraper bug must not take down the bundle
    private <S extends Signal> CompletableFuture<S> guarded(Scraper<S> scraper, ScrapeRequest request) {
        CompletableFuture<S> task;
        try {
            task = scraper.fetch(ctx, request);
        } catch (RuntimeException e) {
            task = CompletableFuture.failedFuture(e);
        }
        return task.exceptionally(error -> {
            LOGGER.log(Level.WARNING, "Scraper " + scraper.source().wireName() + " failed unexpectedly", error);
            return scraper.fallback(request);
        });
    }
}
