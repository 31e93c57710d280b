package com.gigpulse.core.forecast;

import com.gigpulse.core.bus.EventBus;
import com.gigpulse.core.events.AlertRaised;
import com.gigpulse.core.events.Event;
import com.gigpulse.core.model.Category;
import com.gigpulse.core.model.EarningsEstimate;
import com.gigpulse.core.model.ResolvedLocation;
import com.gigpulse.core.model.ServiceId;
import com.gigpulse.core.model.ServiceProfile;
import com.gigpulse.core.model.SignalBundle;
import com.gigpulse.core.model.SignalSource;
import com.gigpulse.core.model.TrafficSignal;
import com.gigpulse.core.support.ForecastFixtures;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.BiConsumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EarningsAggregatorTest {
    private static final Set<ServiceId> ALL = EnumSet.allOf(ServiceId.class);

    private final ForecastTuning tuning = ForecastTuning.defaults();
    private final ServiceCatalog catalog = ServiceCatalog.defaults();
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-06T12:00:00Z"), ZoneOffset.UTC);
    private final ResolvedLocation sanFrancisco = ForecastFixtures.sanFrancisco();

    @Test
    void everyHourYieldsOrderedBoundedEstimatesForAllServices() {
        EarningsAggregator aggregator = aggregator(new EventBus(failOnError()));

        for (int hour = 0; hour < 24; hour++) {
            List<EarningsEstimate> estimates = aggregator.estimate(
                    sanFrancisco, ForecastFixtures.slot(hour), ForecastFixtures.defaults(hour), ALL);

            assertEquals(List.of(ServiceId.values()), services(estimates));
            for (EarningsEstimate estimate : estimates) {
                assertTrue(estimate.min() <= estimate.max(), estimate.service() + " at " + hour);
                assertTrue(estimate.min() >= 0.0);
                assertTrue(estimate.demandScore() >= 0.0 && estimate.demandScore() <= 1.0);
                assertEquals("San Francisco", estimate.location());
            }
        }
    }

    @Test
    void deliveryOutscoresRideshareAtMealtimesAndRideshareAtCommute() {
        EarningsAggregator aggregator = aggregator(new EventBus(failOnError()));

        for (int hour : new int[]{12, 18}) {
            List<EarningsEstimate> estimates = estimateDefaults(aggregator, hour);
            assertTrue(score(estimates, ServiceId.DOORDASH) >= score(estimates, ServiceId.UBER), "hour " + hour);
        }
        for (int hour : new int[]{8, 17}) {
            List<EarningsEstimate> estimates = estimateDefaults(aggregator, hour);
            assertTrue(score(estimates, ServiceId.UBER) >= score(estimates, ServiceId.DOORDASH), "hour " + hour);
        }
    }

    @Test
    void demandScoreIsRatioOverReferenceRounded() {
        List<EarningsEstimate> estimates = estimateDefaults(aggregator(new EventBus(failOnError())), 8);

        assertEquals(0.77, score(estimates, ServiceId.UBER));
        assertEquals(0.57, score(estimates, ServiceId.GRUBHUB));
    }

    @Test
    void degradedContributingSignalsWidenTheBand() {
        EarningsAggregator aggregator = aggregator(new EventBus(failOnError()));
        SignalBundle live = ForecastFixtures.live(14, 2, 1.05, 1.0);
        SignalBundle noTraffic = new SignalBundle(
                live.events(), live.weather(), TrafficSignal.unavailable(14), live.fuel(), live.pricing());

        List<EarningsEstimate> fresh = aggregator.estimate(sanFrancisco, ForecastFixtures.slot(14), live, ALL);
        List<EarningsEstimate> partial = aggregator.estimate(sanFrancisco, ForecastFixtures.slot(14), noTraffic, ALL);

        assertEquals(10.0, width(fresh, ServiceId.UBER), 0.011);
        assertEquals(12.0, width(fresh, ServiceId.DOORDASH), 0.011);
        assertEquals(15.0, width(partial, ServiceId.UBER), 0.011);
        // traffic does not feed the delivery model
        assertEquals(12.0, width(partial, ServiceId.DOORDASH), 0.011);
    }

    @Test
    void sameInputsGiveSameEstimates() {
        SignalBundle signals = ForecastFixtures.live(19, 12, 1.3, 1.4);

        List<EarningsEstimate> first = aggregator(new EventBus(failOnError()))
                .estimate(sanFrancisco, ForecastFixtures.slot(19), signals, ALL);
        List<EarningsEstimate> second = aggregator(new EventBus(failOnError()))
                .estimate(sanFrancisco, ForecastFixtures.slot(19), signals, ALL);

        assertEquals(first, second);
    }

    @Test
    void requestedSubsetOnlyAndSurgeVersusPeakSemantics() {
        List<EarningsEstimate> estimates = aggregator(new EventBus(failOnError())).estimate(
                sanFrancisco,
                ForecastFixtures.slot(18),
                ForecastFixtures.defaults(18),
                EnumSet.of(ServiceId.GRUBHUB, ServiceId.LYFT)
        );

        assertEquals(List.of(ServiceId.LYFT, ServiceId.GRUBHUB), services(estimates));
        assertTrue(estimates.get(0).surgeOrPeakValue() >= 1.0);
        assertEquals(2.0, estimates.get(1).surgeOrPeakValue());
        assertEquals("Restaurant Districts", estimates.get(1).hotspot());
    }

    @Test
    void computationFailureFallsBackToConservativeEstimate() {
        List<AlertRaised> alerts = new ArrayList<>();
        EventBus bus = new EventBus(failOnError());
        bus.subscribe(AlertRaised.class, alerts::add);
        EarningsAggregator aggregator = new EarningsAggregator(
                tuning,
                catalog,
                List.of(new ExplodingRideshare(), new DeliveryStrategy(tuning)),
                bus,
                clock
        );

        List<EarningsEstimate> estimates = estimateDefaults(aggregator, 8);
        EarningsEstimate uber = estimates.get(0);

        assertEquals(ServiceId.UBER, uber.service());
        assertEquals(8.0, uber.min());
        assertEquals(8.0 + 5.0 * 1.5, uber.max());
        assertEquals(0.5, uber.demandScore());
        assertEquals(1.0, uber.surgeOrPeakValue());
        assertTrue(score(estimates, ServiceId.DOORDASH) > 0.5);
        assertEquals(2, alerts.size());
        assertEquals(AlertRaised.CATEGORY_FORECAST, alerts.get(0).category());
        assertEquals(clock.instant(), alerts.get(0).timestamp());
    }

    @Test
    void nonFiniteRatioFallsBackForTheWholeCategory() {
        CategoryStrategy brokenMarket = new CategoryStrategy() {
            @Override
            public Category category() {
                return Category.DELIVERY;
            }

            @Override
            public Set<SignalSource> contributingSources() {
                return EnumSet.noneOf(SignalSource.class);
            }

            @Override
            public MarketConditions market(ForecastInput input) {
                return new MarketConditions(1.0, 0.0, Double.POSITIVE_INFINITY);
            }

            @Override
            public ServiceForecast forecast(ServiceProfile profile, ForecastInput input, MarketConditions market) {
                throw new AssertionError("forecast must not run without a market");
            }
        };
        EarningsAggregator aggregator = new EarningsAggregator(
                tuning, catalog, List.of(new RideshareStrategy(tuning), brokenMarket), new EventBus(), clock);

        List<EarningsEstimate> estimates = estimateDefaults(aggregator, 12);

        for (EarningsEstimate estimate : estimates) {
            if (estimate.service().category() == Category.DELIVERY) {
                assertEquals(10.0, estimate.min());
                assertEquals(19.0, estimate.max());
                assertEquals(0.0, estimate.surgeOrPeakValue());
            }
        }
    }

    @Test
    void bothCategoriesNeedAStrategy() {
        assertThrows(IllegalArgumentException.class, () -> new EarningsAggregator(
                tuning, catalog, List.of(new RideshareStrategy(tuning)), new EventBus(), clock));
    }

    private EarningsAggregator aggregator(EventBus bus) {
        return new EarningsAggregator(tuning, catalog, bus, clock);
    }

    private List<EarningsEstimate> estimateDefaults(EarningsAggregator aggregator, int hour) {
        return aggregator.estimate(sanFrancisco, ForecastFixtures.slot(hour), ForecastFixtures.defaults(hour), ALL);
    }

    private static BiConsumer<Event, Exception> failOnError() {
        return (event, error) -> {
            throw new AssertionError("Unexpected handler failure for " + event.type(), error);
        };
    }

    private static List<ServiceId> services(List<EarningsEstimate> estimates) {
        return estimates.stream().map(EarningsEstimate::service).toList();
    }

    private static double score(List<EarningsEstimate> estimates, ServiceId service) {
        return find(estimates, service).demandScore();
    }

    private static double width(List<EarningsEstimate> estimates, ServiceId service) {
        EarningsEstimate estimate = find(estimates, service);
        return estimate.max() - estimate.min();
    }

    private static EarningsEstimate find(List<EarningsEstimate> estimates, ServiceId service) {
        return estimates.stream()
                .filter(estimate -> estimate.service() == service)
                .findFirst()
                .orElseThrow();
    }

    private final class ExplodingRideshare implements CategoryStrategy {
        private final RideshareStrategy delegate = new RideshareStrategy(tuning);

        @Override
        public Category category() {
            return Category.RIDESHARE;
        }

        @Override
        public Set<SignalSource> contributingSources() {
            return delegate.contributingSources();
        }

        @Override
        public MarketConditions market(ForecastInput input) {
            return delegate.market(input);
        }

        @Override
        public ServiceForecast forecast(ServiceProfile profile, ForecastInput input, MarketConditions market) {
            throw new ArithmeticException("/ by zero");
        }
    }
}
