package com.gigpulse.core.forecast;

import com.gigpulse.core.model.ResolvedLocation;
import com.gigpulse.core.model.SignalBundle;
import com.gigpulse.core.model.TimeSlot;

public record ForecastInput(ResolvedLocation location, TimeSlot slot, SignalBundle signals) {
    public int hour() {
        return slot.hour();
    }
}
