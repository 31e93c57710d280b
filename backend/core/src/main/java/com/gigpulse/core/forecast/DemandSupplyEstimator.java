package com.gigpulse.core.forecast;

import com.gigpulse.core.model.SignalBundle;

public final class DemandSupplyEstimator {
    private final ForecastTuning tuning;

    public DemandSupplyEstimator(ForecastTuning tuning) {
        this.tuning = tuning;
    }

    public MarketConditions rideshare(int hour, SignalBundle signals) {
        CategoryTuning t = tuning.rideshare();
        double demand = t.baseDemand()
                * t.demandFactor(hour)
                * signals.events().demandMultiplier()
                * signals.weather().multiplier();
        return MarketConditions.of(demand, t.baseSupply() * t.supplyFactor(hour));
    }

    public MarketConditions delivery(int hour, SignalBundle signals, double restaurantDensity) {
        CategoryTuning t = tuning.delivery();
        double weatherBoost = 1.0 + (signals.weather().multiplier() - 1.0) * tuning.deliveryWeatherAmplifier();
        double demand = t.baseDemand()
                * t.demandFactor(hour)
                * signals.events().demandMultiplier()
                * weatherBoost
                * restaurantDensity;
        return MarketConditions.of(demand, t.baseSupply() * t.supplyFactor(hour));
    }
}
