package com.gigpulse.core.model;

import com.gigpulse.core.util.HourFormat;

import java.time.LocalDate;
import java.util.Objects;

public record TimeSlot(LocalDate date, int hour) {
    public TimeSlot {
        Objects.requireNonNull(date, "date is required");
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("hour must be within [0, 23], was " + hour);
        }
    }

    public String label() {
        return HourFormat.slotLabel(hour);
    }
}
