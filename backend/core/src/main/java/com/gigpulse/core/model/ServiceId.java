package com.gigpulse.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public enum ServiceId {
    UBER("Uber", Category.RIDESHARE, "#4285F4"),
    LYFT("Lyft", Category.RIDESHARE, "#FF00BF"),
    DOORDASH("DoorDash", Category.DELIVERY, "#FFD700"),
    UBER_EATS("UberEats", Category.DELIVERY, "#06C167"),
    GRUBHUB("GrubHub", Category.DELIVERY, "#FF8000");

    private final String displayName;
    private final Category category;
    private final String color;

    ServiceId(String displayName, Category category, String color) {
        this.displayName = displayName;
        this.category = category;
        this.color = color;
    }

    @JsonValue
    public String displayName() {
        return displayName;
    }

    public Category category() {
        return category;
    }

    public String color() {
        return color;
    }

    public static Set<ServiceId> inCategory(Category category) {
        EnumSet<ServiceId> matching = EnumSet.noneOf(ServiceId.class);
        for (ServiceId id : values()) {
            if (id.category == category) {
                matching.add(id);
            }
        }
        return matching;
    }

    // "UberEats", "uber_eats", "Uber Eats" and UBER_EATS all match
    public static Optional<ServiceId> lookup(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String wanted = squash(raw);
        for (ServiceId id : values()) {
            if (squash(id.displayName).equals(wanted) || squash(id.name()).equals(wanted)) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static ServiceId fromJson(String raw) {
        return lookup(raw).orElseThrow(() -> new IllegalArgumentException("Unknown service: " + raw));
    }

    private static String squash(String value) {
        return value.toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
    }
}
