package com.gigpulse.core.forecast;

import com.gigpulse.core.model.Category;
import com.gigpulse.core.model.ServiceProfile;
import com.gigpulse.core.model.SignalBundle;
import com.gigpulse.core.model.SignalSource;

import java.util.EnumSet;
import java.util.Set;

public final class DeliveryStrategy implements CategoryStrategy {
    private final ForecastTuning tuning;
    private final DemandSupplyEstimator estimator;
    private final DeadtimeCalculator deadtimeCalculator;
    private final PricingModel pricing;
    private final CostModel costs;

    public DeliveryStrategy(ForecastTuning tuning) {
        this.tuning = tuning;
        this.estimator = new DemandSupplyEstimator(tuning);
        this.deadtimeCalculator = new DeadtimeCalculator(tuning);
        this.pricing = new PricingModel(tuning);
        this.costs = new CostModel(tuning);
    }

    @Override
    public Category category() {
        return Category.DELIVERY;
    }

    @Override
    public Set<SignalSource> contributingSources() {
        return EnumSet.of(SignalSource.EVENTS, SignalSource.WEATHER, SignalSource.FUEL);
    }

    @Override
    public MarketConditions market(ForecastInput input) {
        return estimator.delivery(input.hour(), input.signals(), input.location().city().restaurantDensity());
    }

    @Override
    public ServiceForecast forecast(ServiceProfile profile, ForecastInput input, MarketConditions market) {
        SignalBundle signals = input.signals();
        Deadtime deadtime = deadtimeCalculator.delivery(input.hour(), market.ratio());
        double ordersPerHour = deadtimeCalculator.jobsPerHour(
                tuning.delivery(),
                profile.averageDurationMinutes(),
                deadtime,
                market.ratio()
        );

        double peakPay = pricing.peakPay(profile, input.hour(), signals.events().hourBoost());
        double perOrder = pricing.orderPay(profile, peakPay, input.location().city().tipMultiplier());
        double net = ordersPerHour * perOrder - costs.deliveryHourly(signals.fuel().pricePerGallon());
        return new ServiceForecast(profile.service(), net, ordersPerHour, peakPay);
    }
}
