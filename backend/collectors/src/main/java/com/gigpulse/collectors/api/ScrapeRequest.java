package com.gigpulse.collectors.api;

import com.gigpulse.core.model.ResolvedLocation;
import com.gigpulse.core.model.TimeSlot;

import java.util.Objects;

public record ScrapeRequest(ResolvedLocation location, TimeSlot slot) {
    public ScrapeRequest {
        Objects.requireNonNull(location, "location is required");
        Objects.requireNonNull(slot, "slot is required");
    }

    public int hour() {
        return slot.hour();
    }
}
