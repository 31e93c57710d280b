package com.gigpulse.core.events;

import java.time.Instant;

public record SignalFetched(
        Instant timestamp,
        String source,
        String locationKey,
        String origin,
        boolean degraded,
        boolean memoized,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "SignalFetched";
    }
}
