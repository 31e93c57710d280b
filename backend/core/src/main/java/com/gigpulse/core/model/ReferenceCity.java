package com.gigpulse.core.model;

public record ReferenceCity(
        String key,
        String name,
        String stateCode,
        double latitude,
        double longitude,
        double pricingMultiplier,
        double restaurantDensity,
        double tipMultiplier
) {
    public ReferenceCity {
        if (pricingMultiplier <= 0 || restaurantDensity <= 0 || tipMultiplier <= 0) {
            throw new IllegalArgumentException("City multipliers must be positive for " + key);
        }
    }
}
