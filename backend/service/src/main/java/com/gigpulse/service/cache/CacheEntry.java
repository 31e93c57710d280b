package com.gigpulse.service.cache;

import com.gigpulse.core.model.SlotForecast;

import java.time.Instant;
import java.util.Objects;

public record CacheEntry(String key, SlotForecast value, Instant expiresAt) {
    public CacheEntry {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(value, "value is required");
        Objects.requireNonNull(expiresAt, "expiresAt is required");
    }

    public boolean isLive(Instant now) {
        return now.isBefore(expiresAt);
    }
}
