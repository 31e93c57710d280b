package com.gigpulse.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record SignalBundle(
        EventSignal events,
        WeatherSignal weather,
        TrafficSignal traffic,
        FuelPriceSignal fuel,
        PricingSignal pricing
) {
    public SignalBundle {
        Objects.requireNonNull(events, "events signal is required");
        Objects.requireNonNull(weather, "weather signal is required");
        Objects.requireNonNull(traffic, "traffic signal is required");
        Objects.requireNonNull(fuel, "fuel signal is required");
        Objects.requireNonNull(pricing, "pricing signal is required");
    }

    public static SignalBundle defaults(ResolvedLocation location, TimeSlot slot) {
        return new SignalBundle(
                EventSignal.unavailable(),
                WeatherSignal.unavailable(),
                TrafficSignal.unavailable(slot.hour()),
                FuelPriceSignal.unavailable(location.city().stateCode()),
                PricingSignal.unavailable()
        );
    }

    public List<Signal> all() {
        return List.of(events, weather, traffic, fuel, pricing);
    }

    public Signal get(SignalSource source) {
        for (Signal signal : all()) {
            if (signal.source() == source) {
                return signal;
            }
        }
        throw new IllegalArgumentException("Unknown source " + source);
    }

    public List<SignalSource> liveSources() {
        List<SignalSource> live = new ArrayList<>();
        for (Signal signal : all()) {
            if (!signal.degraded()) {
                live.add(signal.source());
            }
        }
        return live;
    }

    public List<SignalSource> degradedSources() {
        List<SignalSource> degraded = new ArrayList<>();
        for (Signal signal : all()) {
            if (signal.degraded()) {
                degraded.add(signal.source());
            }
        }
        return degraded;
    }
}
