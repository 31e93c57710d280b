package com.gigpulse.core.model;

public record WeatherSignal(
        double multiplier,
        Double temperatureF,
        String conditions,
        String origin,
        boolean degraded
) implements Signal {
    public static WeatherSignal unavailable() {
        return new WeatherSignal(1.0, null, "unknown", DEFAULT_ORIGIN, true);
    }

    @Override
    public SignalSource source() {
        return SignalSource.WEATHER;
    }
}
