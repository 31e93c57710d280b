package com.gigpulse.core.model;

import java.util.Set;

public record TrafficSignal(
        double congestion,
        String origin,
        boolean degraded
) implements Signal {
    private static final Set<Integer> RUSH_HOURS = Set.of(7, 8, 9, 16, 17, 18, 19);

    public TrafficSignal {
        congestion = Math.max(0.0, Math.min(1.0, congestion));
    }

    public static TrafficSignal unavailable(int hour) {
        return new TrafficSignal(RUSH_HOURS.contains(hour) ? 0.7 : 0.5, DEFAULT_ORIGIN, true);
    }

    @Override
    public SignalSource source() {
        return SignalSource.TRAFFIC;
    }
}
