package com.gigpulse.core.forecast;

import java.util.List;

public record CategoryTuning(
        double baseDemand,
        double baseSupply,
        List<Double> demandFactors,
        List<Double> supplyFactors,
        List<Double> deadtimeFactors,
        double baseWaitMinutes,
        double basePickupMinutes,
        double restaurantWaitMinutes,
        double minDeadtimeMinutes,
        double maxDeadtimeMinutes,
        double maxJobsPerHour,
        double milesPerHour,
        double milesPerGallon,
        double wearPerMile,
        double overheadPerHour,
        double netFloor,
        double netCeiling,
        double uncertaintyBand,
        double referenceRatio
) {
    public CategoryTuning {
        demandFactors = hourTable("demandFactors", demandFactors);
        supplyFactors = hourTable("supplyFactors", supplyFactors);
        deadtimeFactors = hourTable("deadtimeFactors", deadtimeFactors);
        if (baseDemand <= 0 || baseSupply <= 0) {
            throw new IllegalArgumentException("Base demand and supply must be positive");
        }
        if (minDeadtimeMinutes <= 0 || maxDeadtimeMinutes < minDeadtimeMinutes) {
            throw new IllegalArgumentException("Deadtime bounds must satisfy 0 < min <= max");
        }
        if (milesPerGallon <= 0 || referenceRatio <= 0 || maxJobsPerHour <= 0) {
            throw new IllegalArgumentException("mpg, referenceRatio and maxJobsPerHour must be positive");
        }
        if (netCeiling < netFloor) {
            throw new IllegalArgumentException("netCeiling must not be below netFloor");
        }
    }

    public double demandFactor(int hour) {
        return demandFactors.get(hour);
    }

    public double supplyFactor(int hour) {
        return supplyFactors.get(hour);
    }

    public double deadtimeFactor(int hour) {
        return deadtimeFactors.get(hour);
    }

    private static List<Double> hourTable(String name, List<Double> values) {
        if (values == null || values.size() != 24) {
            throw new IllegalArgumentException(name + " must hold exactly 24 hourly values");
        }
        for (Double value : values) {
            if (value == null || value <= 0) {
                throw new IllegalArgumentException(name + " values must be positive");
            }
        }
        return List.copyOf(values);
    }
}
