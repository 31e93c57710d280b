package com.gigpulse.collectors.pricing;

import com.gigpulse.collectors.api.ScrapeContext;
import com.gigpulse.collectors.api.ScrapeException;
import com.gigpulse.collectors.support.EventCapture;
import com.gigpulse.collectors.support.LocalHttpServer;
import com.gigpulse.collectors.support.ScrapeFixtures;
import com.gigpulse.core.bus.EventBus;
import com.gigpulse.core.events.AlertRaised;
import com.gigpulse.core.model.PricingSignal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.gigpulse.collectors.support.FixtureUtils.fixture;
import static com.gigpulse.collectors.support.LocalHttpServer.respond;
import static com.gigpulse.collectors.support.ScrapeFixtures.TODAY;
import static com.gigpulse.collectors.support.ScrapeFixtures.request;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PricingScraperTest {
    private LocalHttpServer server;
    private ExecutorService executor;
    private EventCapture capture;
    private ScrapeContext ctx;

    @BeforeEach
    void setUp() throws Exception {
        server = new LocalHttpServer();
        executor = Executors.newFixedThreadPool(2);
        EventBus bus = ScrapeFixtures.strictBus();
        capture = new EventCapture(bus);
        ctx = ScrapeFixtures.context(bus, ScrapeFixtures.clock(), executor);
    }

    @AfterEach
    void tearDown() {
        server.close();
        executor.shutdownNow();
    }

    @Test
    void medianObservedBaseFareScalesTheReference() {
        server.route("/fares/", respond(200, fixture("fare-estimate.html")));
        PricingScraper scraper = new PricingScraper(ScrapeFixtures.settings(server.baseUrl() + "/fares/{city}"));

        PricingSignal signal = scraper.fetch(ctx, request(TODAY, 9)).join();

        assertEquals(2.55, signal.observedBaseFare());
        assertEquals(2.55 / 2.20, signal.fareAdjustment(), 1e-9);
        assertEquals("fare_estimate", signal.origin());
        assertFalse(signal.degraded());
        assertEquals("/fares/san-francisco", server.requests().get(0));
    }

    @Test
    void adjustmentIsClamped() {
        server.route("/fares/", respond(200, "<li>$9.10</li><li>$9.40</li><li>$9.90</li>"));
        PricingScraper scraper = new PricingScraper(ScrapeFixtures.settings(server.baseUrl() + "/fares/{city}"));

        assertEquals(1.25, scraper.fetch(ctx, request(TODAY, 9)).join().fareAdjustment());
    }

    @Test
    void urlWithoutCityPlaceholderIsNotConfigured() {
        PricingScraper scraper = new PricingScraper(ScrapeFixtures.settings(server.baseUrl() + "/fares"));

        PricingSignal signal = scraper.fetch(ctx, request(TODAY, 9)).join();

        assertEquals(PricingSignal.unavailable(), signal);
        assertTrue(server.requests().isEmpty());
        assertEquals(1, capture.byType(AlertRaised.class).size());
    }

    @Test
    void tooFewSamplesAreRejected() {
        assertThrows(ScrapeException.class, () -> PricingScraper.medianBaseFare("$2.50 and $3.10"));
        assertEquals(2.8, PricingScraper.medianBaseFare("$2.50 $3.10 $2.40 $3.20"), 1e-9);
    }
}
