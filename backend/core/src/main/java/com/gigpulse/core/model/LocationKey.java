package com.gigpulse.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

public record LocationKey(String value) {
    public LocationKey {
        Objects.requireNonNull(value, "value is required");
        if (value.isBlank()) {
            throw new IllegalArgumentException("location key must not be blank");
        }
    }

    public static LocationKey ofCoordinates(double latitude, double longitude) {
        return new LocationKey(String.format(Locale.ROOT, "%.4f,%.4f", latitude, longitude));
    }

    public static LocationKey ofName(String name) {
        return new LocationKey(normalizeName(name));
    }

    public static String normalizeName(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
