package com.gigpulse.collectors.events;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

public final class EventBoostCalculator {
    static final double MAX_BOOST = 1.5;
    static final int DEFAULT_CAPACITY = 1_000;
    private static final Duration DEFAULT_LENGTH = Duration.ofHours(2);

    public double boostAt(List<ListedEvent> events, LocalDateTime hourStart) {
        LocalDateTime hourEnd = hourStart.plusHours(1);
        double total = 0.0;
        for (ListedEvent event : events) {
            int capacity = event.capacity() == null ? DEFAULT_CAPACITY : event.capacity();
            Duration window = surgeWindow(capacity);
            LocalDateTime end = event.end() == null || !event.end().isAfter(event.start())
                    ? event.start().plus(DEFAULT_LENGTH)
                    : event.end();
            LocalDateTime from = event.start().minus(window);
            LocalDateTime to = end.plus(window);
            if (hourStart.isBefore(to) && hourEnd.isAfter(from)) {
                total += boostFor(capacity);
            }
        }
        return Math.min(total, MAX_BOOST);
    }

    static double boostFor(int capacity) {
        if (capacity < 500) {
            return 0.05;
        }
        if (capacity < 5_000) {
            return 0.2;
        }
        return 0.5;
    }

    static Duration surgeWindow(int capacity) {
        if (capacity < 500) {
            return Duration.ofHours(1);
        }
        if (capacity < 5_000) {
            return Duration.ofHours(2);
        }
        return Duration.ofHours(3);
    }
}
