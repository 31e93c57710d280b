package com.gigpulse.core.forecast;

import com.gigpulse.core.model.Category;
import com.gigpulse.core.model.ServiceProfile;
import com.gigpulse.core.model.SignalBundle;
import com.gigpulse.core.model.SignalSource;

import java.util.EnumSet;
import java.util.Set;

public final class RideshareStrategy implements CategoryStrategy {
    private final ForecastTuning tuning;
    private final DemandSupplyEstimator estimator;
    private final DeadtimeCalculator deadtimeCalculator;
    private final PricingModel pricing;
    private final CostModel costs;

    public RideshareStrategy(ForecastTuning tuning) {
        this.tuning = tuning;
        this.estimator = new DemandSupplyEstimator(tuning);
        this.deadtimeCalculator = new DeadtimeCalculator(tuning);
        this.pricing = new PricingModel(tuning);
        this.costs = new CostModel(tuning);
    }

    @Override
    public Category category() {
        return Category.RIDESHARE;
    }

    @Override
    public Set<SignalSource> contributingSources() {
        return EnumSet.allOf(SignalSource.class);
    }

    @Override
    public MarketConditions market(ForecastInput input) {
        return estimator.rideshare(input.hour(), input.signals());
    }

    @Override
    public ServiceForecast forecast(ServiceProfile profile, ForecastInput input, MarketConditions market) {
        SignalBundle signals = input.signals();
        double congestion = signals.traffic().congestion();
        double tripMinutes = profile.averageDurationMinutes() * (1.0 + tuning.trafficDurationWeight() * congestion);

        Deadtime deadtime = deadtimeCalculator.rideshare(input.hour(), market.ratio(), congestion);
        double tripsPerHour = deadtimeCalculator.jobsPerHour(tuning.rideshare(), tripMinutes, deadtime, market.ratio());

        double rateMultiplier = input.location().city().pricingMultiplier() * signals.pricing().fareAdjustment();
        double surge = pricing.surge(market.ratio(), signals.events().hourBoost());
        double perTrip = pricing.tripFare(profile, tripMinutes, rateMultiplier) * surge;

        double hourlyCosts = costs.rideshareHourly(
                congestion,
                deadtime.pickupMinutes() * tripsPerHour,
                signals.fuel().pricePerGallon()
        );
        double net = tripsPerHour * perTrip - hourlyCosts;
        return new ServiceForecast(profile.service(), net, tripsPerHour, surge);
    }
}
