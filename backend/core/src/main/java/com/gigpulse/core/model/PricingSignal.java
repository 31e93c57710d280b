package com.gigpulse.core.model;

public record PricingSignal(
        double fareAdjustment,
        Double observedBaseFare,
        String origin,
        boolean degraded
) implements Signal {
    public PricingSignal {
        if (fareAdjustment <= 0) {
            throw new IllegalArgumentException("fareAdjustment must be > 0");
        }
    }

    public static PricingSignal unavailable() {
        return new PricingSignal(1.0, null, DEFAULT_ORIGIN, true);
    }

    @Override
    public SignalSource source() {
        return SignalSource.PRICING;
    }
}
