package com.gigpulse.core.model;

import java.util.Objects;

public record ResolvedLocation(
        LocationKey key,
        String label,
        double latitude,
        double longitude,
        ReferenceCity city,
        boolean fallback
) {
    public ResolvedLocation {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(label, "label is required");
        Objects.requireNonNull(city, "city is required");
    }
}
