package com.gigpulse.core.model;

import java.util.Locale;
import java.util.Map;

public record FuelPriceSignal(
        double pricePerGallon,
        String origin,
        boolean degraded
) implements Signal {
    public static final double NATIONAL_DEFAULT = 5.25;

    private static final Map<String, Double> REGIONAL_AVERAGES = Map.of(
            "CA", 5.25,
            "NY", 4.80,
            "TX", 3.90,
            "FL", 4.20,
            "IL", 4.50,
            "WA", 5.10,
            "MA", 4.70,
            "AZ", 4.30
    );

    public FuelPriceSignal {
        if (pricePerGallon <= 0) {
            throw new IllegalArgumentException("pricePerGallon must be > 0");
        }
    }

    public static FuelPriceSignal unavailable(String stateCode) {
        double price = stateCode == null
                ? NATIONAL_DEFAULT
                : REGIONAL_AVERAGES.getOrDefault(stateCode.toUpperCase(Locale.ROOT), NATIONAL_DEFAULT);
        return new FuelPriceSignal(price, DEFAULT_ORIGIN, true);
    }

    @Override
    public SignalSource source() {
        return SignalSource.FUEL;
    }
}
