package com.gigpulse.core.model;

public record EventSignal(
        int eventCount,
        double demandMultiplier,
        double hourBoost,
        String origin,
        boolean degraded
) implements Signal {
    public EventSignal {
        if (eventCount < 0) {
            throw new IllegalArgumentException("eventCount must be >= 0");
        }
        if (demandMultiplier <= 0) {
            throw new IllegalArgumentException("demandMultiplier must be > 0");
        }
    }

    public static EventSignal unavailable() {
        return new EventSignal(0, 1.0, 0.0, DEFAULT_ORIGIN, true);
    }

    @Override
    public SignalSource source() {
        return SignalSource.EVENTS;
    }
}
