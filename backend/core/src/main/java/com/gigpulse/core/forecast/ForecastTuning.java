package com.gigpulse.core.forecast;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gigpulse.core.model.Category;
import com.gigpulse.core.util.JsonUtils;

import java.util.List;
import java.util.Objects;

public record ForecastTuning(
        CategoryTuning rideshare,
        CategoryTuning delivery,
        double surgeCeiling,
        double stackingFactor,
        double stackingRatioThreshold,
        double degradedBandFactor,
        double deliveryWeatherAmplifier,
        double trafficDurationWeight,
        double restaurantRushFactor,
        double pickupSpeedMph,
        List<Integer> mealRushHours,
        EventDemandTable eventDemand
) {
    private static final String BUNDLED = "forecast-tuning.json";

    public ForecastTuning {
        Objects.requireNonNull(rideshare, "rideshare tuning is required");
        Objects.requireNonNull(delivery, "delivery tuning is required");
        Objects.requireNonNull(eventDemand, "eventDemand table is required");
        mealRushHours = mealRushHours == null ? List.of() : List.copyOf(mealRushHours);
        if (surgeCeiling < 1.0 || stackingFactor < 1.0 || degradedBandFactor < 1.0) {
            throw new IllegalArgumentException("surgeCeiling, stackingFactor and degradedBandFactor must be >= 1.0");
        }
    }

    public static ForecastTuning defaults() {
        return JsonUtils.readResource(ForecastTuning.class, BUNDLED, new TypeReference<ForecastTuning>() {
        });
    }

    public CategoryTuning forCategory(Category category) {
        return category == Category.RIDESHARE ? rideshare : delivery;
    }

    public boolean isMealRush(int hour) {
        return mealRushHours.contains(hour);
    }
}
