package com.gigpulse.core.forecast;

import com.gigpulse.core.bus.EventBus;
import com.gigpulse.core.events.AlertRaised;
import com.gigpulse.core.model.Category;
import com.gigpulse.core.model.EarningsEstimate;
import com.gigpulse.core.model.ResolvedLocation;
import com.gigpulse.core.model.ServiceId;
import com.gigpulse.core.model.ServiceProfile;
import com.gigpulse.core.model.SignalBundle;
import com.gigpulse.core.model.SignalSource;
import com.gigpulse.core.model.TimeSlot;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

public final class EarningsAggregator {
    private static final Logger LOGGER = Logger.getLogger(EarningsAggregator.class.getName());

    private final ForecastTuning tuning;
    private final ServiceCatalog catalog;
    private final HotspotTable hotspots;
    private final Map<Category, CategoryStrategy> strategies = new EnumMap<>(Category.class);
    private final EventBus eventBus;
    private final Clock clock;

    public EarningsAggregator(ForecastTuning tuning, ServiceCatalog catalog, EventBus eventBus, Clock clock) {
        this(tuning, catalog, List.of(new RideshareStrategy(tuning), new DeliveryStrategy(tuning)), eventBus, clock);
    }

    public EarningsAggregator(
            ForecastTuning tuning,
            ServiceCatalog catalog,
            List<CategoryStrategy> strategies,
            EventBus eventBus,
            Clock clock
    ) {
        this.tuning = tuning;
        this.catalog = catalog;
        this.hotspots = new HotspotTable();
        this.eventBus = eventBus;
        this.clock = clock;
        for (CategoryStrategy strategy : strategies) {
            this.strategies.put(strategy.category(), strategy);
        }
        for (Category category : Category.values()) {
            if (!this.strategies.containsKey(category)) {
                throw new IllegalArgumentException("No strategy registered for " + category);
            }
        }
    }

    public Set<ServiceId> services() {
        return catalog.services();
    }

    public List<EarningsEstimate> estimate(ResolvedLocation location, TimeSlot slot, SignalBundle signals, Set<ServiceId> services) {
        ForecastInput input = new ForecastInput(location, slot, signals);
        List<EarningsEstimate> estimates = new ArrayList<>();
        for (Category category : Category.values()) {
            List<ServiceId> wanted = services.stream()
                    .filter(service -> service.category() == category)
                    .sorted()
                    .toList();
            if (wanted.isEmpty()) {
                continue;
            }
            CategoryStrategy strategy = strategies.get(category);
            MarketConditions market = marketOrNull(strategy, input);
            for (ServiceId service : wanted) {
                estimates.add(estimateOne(strategy, catalog.profile(service), input, market));
            }
        }
        estimates.sort(Comparator.comparing(EarningsEstimate::service));
        return List.copyOf(estimates);
    }

    private MarketConditions marketOrNull(CategoryStrategy strategy, ForecastInput input) {
        try {
            MarketConditions market = strategy.market(input);
            ForecastComputationException.requireFinite("demand/supply ratio", market.ratio());
            return market;
        } catch (ForecastComputationException | ArithmeticException e) {
            reportComputationFailure(strategy.category().name(), input, e);
            return null;
        }
    }

    private EarningsEstimate estimateOne(
            CategoryStrategy strategy,
            ServiceProfile profile,
            ForecastInput input,
            MarketConditions market
    ) {
        CategoryTuning t = tuning.forCategory(strategy.category());
        String hotspot = hotspots.hotspot(strategy.category(), input.hour());
        if (market == null) {
            return conservative(profile.service(), t, input, hotspot);
        }
        try {
            ServiceForecast forecast = strategy.forecast(profile, input, market);
            double net = clamp(ForecastComputationException.requireFinite("net earnings", forecast.netHourly()), t.netFloor(), t.netCeiling());
            double jobs = ForecastComputationException.requireFinite("jobs per hour", forecast.jobsPerHour());
            double surgeOrPeak = ForecastComputationException.requireFinite("surge/peak", forecast.surgeOrPeakValue());
            double band = uncertaintyBand(strategy, t, input.signals());
            return new EarningsEstimate(
                    profile.service(),
                    input.slot(),
                    input.location().label(),
                    round(Math.max(0.0, net - band), 2),
                    round(net + band, 2),
                    round(clamp(market.ratio() / t.referenceRatio(), 0.0, 1.0), 2),
                    round(jobs, 1),
                    round(surgeOrPeak, 2),
                    hotspot
            );
        } catch (ForecastComputationException | ArithmeticException e) {
            reportComputationFailure(profile.service().displayName(), input, e);
            return conservative(profile.service(), t, input, hotspot);
        }
    }

    private double uncertaintyBand(CategoryStrategy strategy, CategoryTuning t, SignalBundle signals) {
        for (SignalSource source : strategy.contributingSources()) {
            if (signals.get(source).degraded()) {
                return t.uncertaintyBand() * tuning.degradedBandFactor();
            }
        }
        return t.uncertaintyBand();
    }

    private EarningsEstimate conservative(ServiceId service, CategoryTuning t, ForecastInput input, String hotspot) {
        return new EarningsEstimate(
                service,
                input.slot(),
                input.location().label(),
                t.netFloor(),
                round(t.netFloor() + t.uncertaintyBand() * tuning.degradedBandFactor(), 2),
                0.5,
                1.0,
                service.category() == Category.RIDESHARE ? 1.0 : 0.0,
                hotspot
        );
    }

    private void reportComputationFailure(String subject, ForecastInput input, RuntimeException error) {
        LOGGER.warning("Forecast for " + subject + " at " + input.location().key() + " " + input.slot()
                + " fell back to conservative estimate: " + error.getMessage());
        eventBus.publish(new AlertRaised(
                clock.instant(),
                AlertRaised.CATEGORY_FORECAST,
                "Conservative estimate used for " + subject + ": " + error.getMessage(),
                Map.of("location", input.location().key().value(), "hour", input.hour())
        ));
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
