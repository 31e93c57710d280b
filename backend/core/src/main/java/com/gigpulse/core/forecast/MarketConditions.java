package com.gigpulse.core.forecast;

public record MarketConditions(double demand, double supply, double ratio) {
    static final double MIN_VOLUME = 1.0;

    public static MarketConditions of(double demand, double supply) {
        double flooredDemand = floor(demand);
        double flooredSupply = floor(supply);
        return new MarketConditions(flooredDemand, flooredSupply, flooredDemand / flooredSupply);
    }

    private static double floor(double value) {
        return Double.isFinite(value) ? Math.max(MIN_VOLUME, value) : MIN_VOLUME;
    }
}
