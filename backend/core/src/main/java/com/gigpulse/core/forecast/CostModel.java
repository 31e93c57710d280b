package com.gigpulse.core.forecast;

public final class CostModel {
    private final ForecastTuning tuning;

    public CostModel(ForecastTuning tuning) {
        this.tuning = tuning;
    }

    public double rideshareHourly(double congestion, double pickupMinutesPerHour, double fuelPrice) {
        CategoryTuning t = tuning.rideshare();
        double miles = t.milesPerHour() * (1.0 + 0.2 * congestion)
                + pickupMinutesPerHour / 60.0 * tuning.pickupSpeedMph();
        return hourly(t, miles, fuelPrice);
    }

    public double deliveryHourly(double fuelPrice) {
        CategoryTuning t = tuning.delivery();
        return hourly(t, t.milesPerHour(), fuelPrice);
    }

    static double hourly(CategoryTuning t, double milesPerHour, double fuelPrice) {
        return milesPerHour * (fuelPrice / t.milesPerGallon())
                + milesPerHour * t.wearPerMile()
                + t.overheadPerHour();
    }
}
