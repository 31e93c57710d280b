package com.gigpulse.core.location;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gigpulse.core.model.ReferenceCity;
import com.gigpulse.core.util.JsonUtils;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class ReferenceCityCatalog {
    private static final String BUNDLED = "reference-cities.json";

    private final Map<String, ReferenceCity> byKey = new LinkedHashMap<>();

    public ReferenceCityCatalog(List<ReferenceCity> cities) {
        if (cities.isEmpty()) {
            throw new IllegalArgumentException("Reference catalog needs at least one city");
        }
        for (ReferenceCity city : cities) {
            byKey.put(city.key(), city);
        }
    }

    public static ReferenceCityCatalog defaults() {
        return new ReferenceCityCatalog(JsonUtils.readResource(
                ReferenceCityCatalog.class,
                BUNDLED,
                new TypeReference<List<ReferenceCity>>() {
                }
        ));
    }

    public List<ReferenceCity> cities() {
        return List.copyOf(byKey.values());
    }

    public Optional<ReferenceCity> byKey(String key) {
        return Optional.ofNullable(byKey.get(key));
    }

    public Optional<ReferenceCity> matchName(String normalizedName) {
        ReferenceCity exact = byKey.get(normalizedName);
        if (exact != null) {
            return Optional.of(exact);
        }
        return byKey.values().stream()
                .filter(city -> normalizedName.contains(city.key()))
                .max(Comparator.comparingInt(city -> city.key().length()));
    }

    public ReferenceCity nearest(double latitude, double longitude) {
        ReferenceCity best = null;
        double bestDistance = Double.MAX_VALUE;
        for (ReferenceCity city : byKey.values()) {
            double distance = straightLineDistance(latitude, longitude, city.latitude(), city.longitude());
            if (distance < bestDistance) {
                bestDistance = distance;
                best = city;
            }
        }
        return best;
    }

    // equirectangular distance
    static double straightLineDistance(double lat1, double lng1, double lat2, double lng2) {
        double meanLat = Math.toRadians((lat1 + lat2) / 2.0);
        double dx = Math.toRadians(lng2 - lng1) * Math.cos(meanLat);
        double dy = Math.toRadians(lat2 - lat1);
        return Math.sqrt(dx * dx + dy * dy);
    }
}
