package com.gigpulse.core.forecast;

public final class DeadtimeCalculator {
    private final ForecastTuning tuning;

    public DeadtimeCalculator(ForecastTuning tuning) {
        this.tuning = tuning;
    }

    public Deadtime rideshare(int hour, double ratio, double congestion) {
        CategoryTuning t = tuning.rideshare();
        double waitFactor = ratio > 1.0
                ? Math.max(0.3, 1.0 - (ratio - 1.0) * 0.2)
                : 1.0 + (1.0 - ratio) * 0.5;
        double pickupFactor = ratio > 1.0
                ? Math.max(0.8, 1.0 - (ratio - 1.0) * 0.1)
                : 1.0 + (1.0 - ratio) * 0.2;

        double wait = t.baseWaitMinutes() * t.deadtimeFactor(hour) * waitFactor;
        double pickup = t.basePickupMinutes() * (1.0 + 0.3 * congestion) * pickupFactor;
        double total = clamp(wait + pickup, t.minDeadtimeMinutes(), t.maxDeadtimeMinutes());
        return new Deadtime(wait, pickup, 0.0, total, 1.0);
    }

    public Deadtime delivery(int hour, double ratio) {
        CategoryTuning t = tuning.delivery();
        double waitFactor;
        if (ratio > 1.5) {
            waitFactor = 0.4;
        } else if (ratio > 1.0) {
            waitFactor = 0.7;
        } else {
            waitFactor = 1.5;
        }

        double wait = t.baseWaitMinutes() * t.deadtimeFactor(hour) * waitFactor;
        double restaurant = t.restaurantWaitMinutes() * (tuning.isMealRush(hour) ? tuning.restaurantRushFactor() : 1.0);
        double total = clamp(wait + t.basePickupMinutes() + restaurant, t.minDeadtimeMinutes(), t.maxDeadtimeMinutes());
        double stacking = ratio > tuning.stackingRatioThreshold() ? tuning.stackingFactor() : 1.0;
        return new Deadtime(wait, t.basePickupMinutes(), restaurant, total, stacking);
    }

    public double jobsPerHour(CategoryTuning t, double jobDurationMinutes, Deadtime deadtime, double ratio) {
        double cycleMinutes = jobDurationMinutes + deadtime.totalMinutes();
        double jobs = 60.0 / cycleMinutes * deadtime.stackingFactor();
        return Math.min(Math.min(jobs, t.maxJobsPerHour()), ratio);
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
