package com.gigpulse.core.model;

public record EarningsEstimate(
        ServiceId service,
        TimeSlot slot,
        String location,
        double min,
        double max,
        double demandScore,
        double jobsPerHour,
        double surgeOrPeakValue,
        String hotspot
) {
    public EarningsEstimate {
        if (min > max) {
            throw new IllegalArgumentException("min must not exceed max for " + service);
        }
    }

    public String color() {
        return service.color();
    }
}
