package com.gigpulse.service.forecast;

import com.gigpulse.core.events.ForecastComputed;
import com.gigpulse.core.location.Coordinates;
import com.gigpulse.core.location.Geocoder;
import com.gigpulse.core.location.LocationQuery;
import com.gigpulse.core.model.EarningsEstimate;
import com.gigpulse.core.model.SignalSource;
import com.gigpulse.core.model.SlotForecast;
import com.gigpulse.core.model.TimeSlot;
import com.gigpulse.service.cache.InMemoryForecastCache;
import com.gigpulse.service.support.EventCapture;
import com.gigpulse.service.support.ServiceFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ForecastServiceTest {
    private static final TimeSlot EVENING = new TimeSlot(ServiceFixtures.TODAY, 18);
    private static final LocationQuery SAN_FRANCISCO = LocationQuery.ofName("San Francisco");

    private final ServiceFixtures fixtures = new ServiceFixtures();

    @AfterEach
    void tearDown() {
        fixtures.close();
    }

    @Test
    void repeatedRequestWithinTtlIsACacheHit() {
        ForecastService service = fixtures.forecastService();

        SlotForecast first = service.forecast(SAN_FRANCISCO, EVENING);
        SlotForecast second = service.forecast(SAN_FRANCISCO, EVENING);

        assertSame(first, second);
        assertEquals(1, fixtures.gatherRounds());
        assertEquals(1, service.cacheStats().hits());
    }

    @Test
    void recomputingAfterClearReproducesTheSameForecast() {
        ForecastService service = fixtures.forecastService();

        SlotForecast first = service.forecast(SAN_FRANCISCO, EVENING);
        service.clearCache();
        SlotForecast recomputed = service.forecast(SAN_FRANCISCO, EVENING);

        assertEquals(2, fixtures.gatherRounds());
        assertEquals(first.estimates().size(), recomputed.estimates().size());
        for (int i = 0; i < first.estimates().size(); i++) {
            EarningsEstimate a = first.estimates().get(i);
            EarningsEstimate b = recomputed.estimates().get(i);
            assertEquals(a.service(), b.service());
            assertEquals(a.min(), b.min(), 1e-9);
            assertEquals(a.max(), b.max(), 1e-9);
            assertEquals(a.demandScore(), b.demandScore(), 1e-9);
            assertEquals(a.jobsPerHour(), b.jobsPerHour(), 1e-9);
        }
    }

    @Test
    void liveForecastCoversEveryServiceAndSource() {
        SlotForecast forecast = fixtures.forecastService().forecast(SAN_FRANCISCO, EVENING);

        assertEquals(5, forecast.estimates().size());
        assertTrue(forecast.usingLiveData());
        assertEquals(List.of(SignalSource.values()), forecast.dataSources());
        assertTrue(forecast.degradedSources().isEmpty());
        assertEquals("San Francisco", forecast.locationLabel());
        for (EarningsEstimate estimate : forecast.estimates()) {
            assertTrue(estimate.min() <= estimate.max(), estimate.service() + " min exceeds max");
        }
    }

    @Test
    void everySourceFailingMatchesTheLightweightPath() {
        fixtures.failEverySource();
        ForecastService service = fixtures.forecastService();

        SlotForecast full = service.forecast(SAN_FRANCISCO, EVENING);
        SlotForecast lightweight = service.lightweight(SAN_FRANCISCO, EVENING);

        assertFalse(full.usingLiveData());
        assertFalse(lightweight.usingLiveData());
        assertEquals(lightweight, full);
        assertEquals(List.of(SignalSource.values()), full.degradedSources());
    }

    @Test
    void lightweightPathResolvesGeocodedPlacesLikeTheFullPath() {
        fixtures.failEverySource();
        AtomicInteger lookups = new AtomicInteger();
        Geocoder brooklynOnly = new Geocoder() {
            @Override
            public Optional<Coordinates> forward(String query) {
                lookups.incrementAndGet();
                return query.equalsIgnoreCase("brooklyn") ? Optional.of(new Coordinates(40.6782, -73.9442)) : Optional.empty();
            }

            @Override
            public Optional<String> reverse(double latitude, double longitude) {
                return Optional.of("Brooklyn");
            }
        };
        ForecastService service = fixtures.forecastService(fixtures.cache(), brooklynOnly);
        LocationQuery brooklyn = LocationQuery.ofName("Brooklyn");

        SlotForecast lightweight = service.lightweight(brooklyn, EVENING);
        SlotForecast full = service.forecast(brooklyn, EVENING);

        assertFalse(lightweight.locationFallback());
        assertEquals(full.locationLabel(), lightweight.locationLabel());
        assertEquals(full.locationKey(), lightweight.locationKey());
        assertEquals(lightweight, full);
        assertEquals(1, lookups.get());
    }

    @Test
    void weatherOutageLeavesAFullPredictionSetWithoutWeather() {
        fixtures.weather.failing(true);

        SlotForecast forecast = fixtures.forecastService().forecast(SAN_FRANCISCO, EVENING);

        assertEquals(5, forecast.estimates().size());
        assertTrue(forecast.usingLiveData());
        assertFalse(forecast.dataSources().contains(SignalSource.WEATHER));
        assertEquals(List.of(SignalSource.WEATHER), forecast.degradedSources());
    }

    @Test
    void lightweightPathNeverScrapesOrCaches() {
        ForecastService service = fixtures.forecastService();

        SlotForecast forecast = service.lightweight(SAN_FRANCISCO, EVENING);

        assertEquals(5, forecast.estimates().size());
        assertEquals(0, fixtures.gatherRounds());
        assertEquals(0, service.cacheStats().size());
    }

    @Test
    void concurrentRequestsForOneSlotTriggerOneGather() throws Exception {
        fixtures.events.delayMillis(200);
        ForecastService service = fixtures.forecastService();
        int callers = 10;
        CountDownLatch ready = new CountDownLatch(callers);
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<Future<SlotForecast>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    ready.countDown();
                    ready.await();
                    return service.forecast(SAN_FRANCISCO, EVENING);
                }));
            }
            SlotForecast first = results.get(0).get(5, TimeUnit.SECONDS);
            for (Future<SlotForecast> result : results) {
                assertSame(first, result.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, fixtures.gatherRounds());
        assertEquals(1, service.cacheStats().computations());
    }

    @Test
    void unavailableCacheFallsBackToDirectComputation() {
        InMemoryForecastCache cache = fixtures.cache();
        ForecastService service = fixtures.forecastService(cache);
        cache.close();

        SlotForecast first = service.forecast(SAN_FRANCISCO, EVENING);
        SlotForecast second = service.forecast(SAN_FRANCISCO, EVENING);

        assertEquals(5, first.estimates().size());
        assertEquals(first, second);
        assertEquals(2, fixtures.gatherRounds());
    }

    @Test
    void publishesForecastComputedOncePerComputation() {
        EventCapture capture = new EventCapture(fixtures.eventBus);
        ForecastService service = fixtures.forecastService();

        service.forecast(SAN_FRANCISCO, EVENING);
        service.forecast(SAN_FRANCISCO, EVENING);

        List<ForecastComputed> computed = capture.byType(ForecastComputed.class);
        assertEquals(1, computed.size());
        assertEquals("san francisco", computed.get(0).locationKey());
        assertEquals(EVENING.date(), computed.get(0).date());
        assertEquals(18, computed.get(0).hour());
        assertTrue(computed.get(0).usingLiveData());
    }

    @Test
    void coordinatesShareOneCacheEntryWithinRounding() {
        ForecastService service = fixtures.forecastService();

        SlotForecast first = service.forecast(LocationQuery.ofCoordinates(37.77491, -122.41941), EVENING);
        SlotForecast second = service.forecast(LocationQuery.ofCoordinates(37.77489, -122.41939), EVENING);

        assertSame(first, second);
        assertEquals("37.7749,-122.4194", first.locationKey().value());
        assertEquals(1, fixtures.gatherRounds());
    }

    @Test
    void batchReturnsOneForecastPerHourInRequestOrder() {
        ForecastService service = fixtures.forecastService();

        List<SlotForecast> forecasts = service.batch(SAN_FRANCISCO, ServiceFixtures.TODAY, List.of(18, 9, 12));

        assertEquals(List.of(18, 9, 12), forecasts.stream().map(f -> f.slot().hour()).toList());
        assertEquals(3, fixtures.gatherRounds());
    }

    @Test
    void weekComputesOnlyTheSlotsNotAlreadyCached() {
        ForecastService service = fixtures.forecastService();
        LocalDate monday = LocalDate.of(2026, 3, 2);
        service.forecast(SAN_FRANCISCO, new TimeSlot(monday, 8));
        assertEquals(1, fixtures.gatherRounds());

        Map<LocalDate, Map<Integer, SlotForecast>> week = service.week(SAN_FRANCISCO, monday, 7, 6, 23);

        assertEquals(7, week.size());
        assertEquals(List.of(monday, monday.plusDays(1), monday.plusDays(2), monday.plusDays(3),
                monday.plusDays(4), monday.plusDays(5), monday.plusDays(6)), new ArrayList<>(week.keySet()));
        for (Map<Integer, SlotForecast> hours : week.values()) {
            assertEquals(18, hours.size());
            assertEquals(6, hours.keySet().iterator().next());
        }
        assertEquals(7 * 18, fixtures.gatherRounds());

        service.week(SAN_FRANCISCO, monday, 7, 6, 23);
        assertEquals(7 * 18, fixtures.gatherRounds());
    }
}
