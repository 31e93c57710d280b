package com.gigpulse.core.events;

import java.time.Instant;
import java.time.LocalDate;

public record ForecastComputed(
        Instant timestamp,
        String locationKey,
        LocalDate date,
        int hour,
        boolean usingLiveData,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "ForecastComputed";
    }
}
