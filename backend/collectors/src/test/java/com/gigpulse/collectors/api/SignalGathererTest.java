package com.gigpulse.collectors.api;

import com.gigpulse.collectors.config.ScraperSettings;
import com.gigpulse.collectors.events.EventDateResolver;
import com.gigpulse.collectors.events.EventScraper;
import com.gigpulse.collectors.events.EventbriteEventIndex;
import com.gigpulse.collectors.events.TicketmasterEventIndex;
import com.gigpulse.collectors.fuel.FuelPriceScraper;
import com.gigpulse.collectors.pricing.PricingScraper;
import com.gigpulse.collectors.support.LocalHttpServer;
import com.gigpulse.collectors.support.ScrapeFixtures;
import com.gigpulse.collectors.traffic.TrafficScraper;
import com.gigpulse.collectors.weather.WeatherScraper;
import com.gigpulse.core.forecast.ForecastTuning;
import com.gigpulse.core.model.EventSignal;
import com.gigpulse.core.model.SignalBundle;
import com.gigpulse.core.model.SignalSource;
import com.gigpulse.core.model.WeatherSignal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.gigpulse.collectors.support.FixtureUtils.fixture;
import static com.gigpulse.collectors.support.LocalHttpServer.respond;
import static com.gigpulse.collectors.support.LocalHttpServer.stall;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SignalGathererTest {
    private static final LocalDate GAME_DAY = LocalDate.of(2026, 3, 8);

    private LocalHttpServer server;
    private ExecutorService executor;
    private ScrapeContext ctx;

    @BeforeEach
    void setUp() throws Exception {
        server = new LocalHttpServer();
        executor = Executors.newFixedThreadPool(8);
        ctx = ScrapeFixtures.context(ScrapeFixtures.strictBus(), ScrapeFixtures.clock(), executor);
    }

    @AfterEach
    void tearDown() {
        server.close();
        executor.shutdownNow();
    }

    @Test
    void everySourceFailingYieldsTheDefaultBundle() {
        server.route("/", respond(500, "everything is down"));
        ScrapeRequest request = ScrapeFixtures.request(GAME_DAY, 18);

        SignalBundle bundle = gatherer(ScrapeFixtures.settings(server.baseUrl())).gather(request);

        assertEquals(SignalBundle.defaults(request.location(), request.slot()), bundle);
        assertTrue(bundle.liveSources().isEmpty());
    }

    @Test
    void slowWeatherOnlyDegradesWeather() {
        server.route("/discovery/v2/events.json", respond(200, fixture("ticketmaster-page0.json")));
        server.route("/data/2.5/", stall(1_500, fixture("openweather-forecast.json")));
        server.route("/maps/api/distancematrix/json", respond(200, fixture("distance-matrix.json")));
        server.route("/fares/", respond(200, fixture("fare-estimate.html")));
        server.route("/", respond(200, fixture("aaa-state.html")));
        ScraperSettings settings = ScrapeFixtures.settings(server.baseUrl()).withTimeoutMillis(400);

        SignalBundle bundle = gatherer(settings).gather(ScrapeFixtures.request(GAME_DAY, 18));

        assertEquals(WeatherSignal.unavailable(), bundle.weather());
        assertEquals(List.of(SignalSource.EVENTS, SignalSource.TRAFFIC, SignalSource.FUEL, SignalSource.PRICING),
                bundle.liveSources());
        assertEquals(List.of(SignalSource.WEATHER), bundle.degradedSources());
        assertEquals(0.5, bundle.traffic().congestion(), 1e-9);
    }

    @Test
    void brokenScraperStillContributesItsFallback() {
        server.route("/", respond(500, "down"));
        ScraperSettings settings = ScrapeFixtures.settings(server.baseUrl());
        SignalGatherer gatherer = new SignalGatherer(
                ctx,
                new ThrowingEventScraper(),
                new WeatherScraper(settings, "owm-key"),
                new TrafficScraper(settings, "maps-key"),
                new FuelPriceScraper(settings),
                new PricingScraper(settings.withBaseUrl(server.baseUrl() + "/fares/{city}"))
        );

        SignalBundle bundle = gatherer.gather(ScrapeFixtures.request(GAME_DAY, 12));

        assertEquals(EventSignal.unavailable(), bundle.events());
        assertEquals(5, gatherer.scrapers().size());
    }

    @Test
    void exceptionallyCompletedScraperStillContributesItsFallback() {
        server.route("/", respond(500, "down"));
        ScraperSettings settings = ScrapeFixtures.settings(server.baseUrl());
        SignalGatherer gatherer = new SignalGatherer(
                ctx,
                new FailingEventScraper(),
                new WeatherScraper(settings, "owm-key"),
                new TrafficScraper(settings, "maps-key"),
                new FuelPriceScraper(settings),
                new PricingScraper(settings)
        );

        SignalBundle bundle = gatherer.gatherAsync(ScrapeFixtures.request(GAME_DAY, 12)).join();

        assertEquals(EventSignal.unavailable(), bundle.events());
    }

    private SignalGatherer gatherer(ScraperSettings settings) {
        ScraperSettings single = new ScraperSettings(true, settings.timeoutMillis(), 0, 900, 1, 2, settings.baseUrl());
        return new SignalGatherer(
                ctx,
                new EventScraper(
                        settings,
                        List.of(
                                new TicketmasterEventIndex(single, "tm-key"),
                                new EventbriteEventIndex(single, new EventDateResolver(10))
                        ),
                        ForecastTuning.defaults().eventDemand()
                ),
                new WeatherScraper(settings, "owm-key"),
                new TrafficScraper(settings, "maps-key"),
                new FuelPriceScraper(settings),
                new PricingScraper(settings.withBaseUrl(settings.baseUrl() + "/fares/{city}"))
        );
    }

    private static final class ThrowingEventScraper implements Scraper<EventSignal> {
        @Override
        public SignalSource source() {
            return SignalSource.EVENTS;
        }

        @Override
        public CompletableFuture<EventSignal> fetch(ScrapeContext ctx, ScrapeRequest request) {
            throw new IllegalStateException("boom");
        }

        @Override
        public EventSignal fallback(ScrapeRequest request) {
            return EventSignal.unavailable();
        }
    }

    private static final class FailingEventScraper implements Scraper<EventSignal> {
        @Override
        public SignalSource source() {
            return SignalSource.EVENTS;
        }

        @Override
        public CompletableFuture<EventSignal> fetch(ScrapeContext ctx, ScrapeRequest request) {
            return CompletableFuture.failedFuture(new IllegalStateException("bad parse"));
        }

        @Override
        public EventSignal fallback(ScrapeRequest request) {
            return EventSignal.unavailable();
        }
    }
}
