package com.gigpulse.collectors.events;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

public record ListedEvent(
        String id,
        String name,
        LocalDateTime start,
        LocalDateTime end,
        Integer capacity,
        String venue
) {
    public ListedEvent {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(start, "start is required");
    }

    public LocalDate date() {
        return start.toLocalDate();
    }
}
