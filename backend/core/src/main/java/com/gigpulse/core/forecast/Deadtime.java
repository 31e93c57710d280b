package com.gigpulse.core.forecast;

public record Deadtime(
        double waitMinutes,
        double pickupMinutes,
        double restaurantMinutes,
        double totalMinutes,
        double stackingFactor
) {
}
