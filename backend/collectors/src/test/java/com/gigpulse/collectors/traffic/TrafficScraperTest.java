package com.gigpulse.collectors.traffic;

import com.gigpulse.collectors.api.ScrapeContext;
import com.gigpulse.collectors.support.EventCapture;
import com.gigpulse.collectors.support.LocalHttpServer;
import com.gigpulse.collectors.support.ScrapeFixtures;
import com.gigpulse.core.bus.EventBus;
import com.gigpulse.core.events.AlertRaised;
import com.gigpulse.core.model.TrafficSignal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.gigpulse.collectors.support.FixtureUtils.fixture;
import static com.gigpulse.collectors.support.LocalHttpServer.respond;
import static com.gigpulse.collectors.support.ScrapeFixtures.NOW;
import static com.gigpulse.collectors.support.ScrapeFixtures.TODAY;
import static com.gigpulse.collectors.support.ScrapeFixtures.request;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TrafficScraperTest {
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
    void congestionIsExtraTimeInTraffic() {
        server.route("/maps/api/distancematrix/json", respond(200, fixture("distance-matrix.json")));
        TrafficScraper scraper = new TrafficScraper(ScrapeFixtures.settings(server.baseUrl()), "maps-key");

        TrafficSignal signal = scraper.fetch(ctx, request(LocalDate.of(2026, 3, 8), 18)).join();

        assertEquals(0.5, signal.congestion(), 1e-9);
        assertEquals("google_distance_matrix", signal.origin());
        assertFalse(signal.degraded());
        String uri = server.requests().get(0);
        assertTrue(uri.contains("origins=37.7749,-122.4194&destinations=37.7949,-122.3994"));
        assertTrue(uri.contains("departure_time=1772992800&key=maps-key"));
    }

    @Test
    void pastSlotsDepartNow() {
        server.route("/maps/api/distancematrix/json", respond(200, fixture("distance-matrix.json")));
        TrafficScraper scraper = new TrafficScraper(ScrapeFixtures.settings(server.baseUrl()), "maps-key");

        scraper.fetch(ctx, request(TODAY, 8)).join();

        assertTrue(server.requests().get(0).contains("departure_time=" + NOW.getEpochSecond()));
    }

    @Test
    void deniedRequestFallsBackToHourlyDefault() {
        server.route("/maps/api/distancematrix/json",
                respond(200, "{\"status\": \"REQUEST_DENIED\", \"rows\": []}"));
        TrafficScraper scraper = new TrafficScraper(ScrapeFixtures.settings(server.baseUrl()), "maps-key");

        TrafficSignal rush = scraper.fetch(ctx, request(TODAY, 17)).join();

        assertEquals(TrafficSignal.unavailable(17), rush);
        assertEquals(0.7, rush.congestion());
        assertTrue(capture.byType(AlertRaised.class).get(0).message().contains("REQUEST_DENIED"));
    }

    @Test
    void serverErrorIsRetriedOnceBeforeGivingUp() {
        server.route("/maps/api/distancematrix/json", respond(502, "bad gateway"));
        TrafficScraper scraper = new TrafficScraper(ScrapeFixtures.settings(server.baseUrl()), "maps-key");

        TrafficSignal signal = scraper.fetch(ctx, request(TODAY, 22)).join();

        assertEquals(0.5, signal.congestion());
        assertTrue(signal.degraded());
        assertEquals(2, server.requestCount("/maps"));
    }
}
