package com.gigpulse.core.forecast;

import java.util.List;
import java.util.Objects;

public record EventDemandTable(List<Step> steps, double ceilingMultiplier) {
    public record Step(int belowCount, double multiplier) {
    }

    public EventDemandTable {
        Objects.requireNonNull(steps, "event demand steps are required");
        steps = List.copyOf(steps);
        for (int i = 1; i < steps.size(); i++) {
            if (steps.get(i).belowCount() <= steps.get(i - 1).belowCount()) {
                throw new IllegalArgumentException("Event demand steps must be strictly ascending");
            }
        }
        if (ceilingMultiplier < 1.0) {
            throw new IllegalArgumentException("Event demand ceilingMultiplier must be >= 1.0");
        }
    }

    public double multiplierFor(int eventCount) {
        for (Step step : steps) {
            if (eventCount < step.belowCount()) {
                return step.multiplier();
            }
        }
        return ceilingMultiplier;
    }
}
