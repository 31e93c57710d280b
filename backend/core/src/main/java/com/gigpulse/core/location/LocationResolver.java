package com.gigpulse.core.location;

import com.gigpulse.core.model.LocationKey;
import com.gigpulse.core.model.ReferenceCity;
import com.gigpulse.core.model.ResolvedLocation;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

public final class LocationResolver {
    private static final Logger LOGGER = Logger.getLogger(LocationResolver.class.getName());
    private static final int MAX_MEMO_ENTRIES = 10_000;

    private final ReferenceCityCatalog catalog;
    private final Geocoder geocoder;
    private final ReferenceCity defaultCity;
    private final Map<String, ResolvedLocation> memo = new ConcurrentHashMap<>();

    public LocationResolver(ReferenceCityCatalog catalog, Geocoder geocoder, String defaultLocation) {
        this.catalog = catalog;
        this.geocoder = geocoder;
        this.defaultCity = catalog.matchName(LocationKey.normalizeName(defaultLocation))
                .orElseThrow(() -> new IllegalArgumentException("Default location is not a reference city: " + defaultLocation));
    }

    public static LocationResolver offline(ReferenceCityCatalog catalog, String defaultLocation) {
        return new LocationResolver(catalog, Geocoder.NONE, defaultLocation);
    }

    public ResolvedLocation resolve(LocationQuery query) {
        if (query.hasCoordinates()) {
            return resolveCoordinates(query.latitude(), query.longitude());
        }
        if (query.name() == null || query.name().isBlank()) {
            return fromCity(defaultCity, false);
        }
        return resolveName(query.name());
    }

    public ResolvedLocation resolveCoordinates(double latitude, double longitude) {
        Coordinates coordinates = new Coordinates(latitude, longitude);
        LocationKey key = LocationKey.ofCoordinates(coordinates.latitude(), coordinates.longitude());
        ResolvedLocation cached = memo.get(key.value());
        if (cached != null) {
            return cached;
        }

        Optional<String> reverse = geocoder.reverse(coordinates.latitude(), coordinates.longitude());
        ResolvedLocation resolved;
        if (reverse.isPresent() && !reverse.get().isBlank()) {
            String name = reverse.get().trim();
            ReferenceCity city = catalog.matchName(LocationKey.normalizeName(name))
                    .orElseGet(() -> catalog.nearest(coordinates.latitude(), coordinates.longitude()));
            resolved = new ResolvedLocation(key, name, coordinates.latitude(), coordinates.longitude(), city, false);
            remember(key.value(), resolved);
        } else {
            ReferenceCity nearest = catalog.nearest(coordinates.latitude(), coordinates.longitude());
            resolved = new ResolvedLocation(key, nearest.name(), coordinates.latitude(), coordinates.longitude(), nearest, true);
            if (geocoder == Geocoder.NONE) {
                remember(key.value(), resolved);
            }
        }
        return resolved;
    }

    public ResolvedLocation resolveName(String rawName) {
        String normalized = LocationKey.normalizeName(rawName);
        ResolvedLocation cached = memo.get(normalized);
        if (cached != null) {
            return cached;
        }

        Optional<ReferenceCity> known = catalog.matchName(normalized);
        if (known.isPresent()) {
            ResolvedLocation resolved = fromCity(known.get(), false);
            remember(normalized, resolved);
            return resolved;
        }

        Optional<Coordinates> coordinates = geocoder.forward(rawName.trim());
        if (coordinates.isPresent()) {
            Coordinates point = coordinates.get();
            ReferenceCity nearest = catalog.nearest(point.latitude(), point.longitude());
            ResolvedLocation resolved = new ResolvedLocation(
                    LocationKey.ofName(normalized),
                    titleCase(normalized),
                    point.latitude(),
                    point.longitude(),
                    nearest,
                    false
            );
            remember(normalized, resolved);
            return resolved;
        }

        LOGGER.warning("Could not resolve location '" + rawName + "'; using " + defaultCity.name());
        return fromCity(defaultCity, true);
    }

    public ReferenceCity defaultCity() {
        return defaultCity;
    }

    private ResolvedLocation fromCity(ReferenceCity city, boolean fallback) {
        return new ResolvedLocation(
                LocationKey.ofName(city.key()),
                city.name(),
                city.latitude(),
                city.longitude(),
                city,
                fallback
        );
    }

    private void remember(String memoKey, ResolvedLocation resolved) {
        if (memo.size() >= MAX_MEMO_ENTRIES) {
            memo.clear();
        }
        memo.put(memoKey, resolved);
    }

    private static String titleCase(String normalized) {
        StringBuilder out = new StringBuilder(normalized.length());
        boolean upperNext = true;
        for (char c : normalized.toCharArray()) {
            out.append(upperNext ? Character.toUpperCase(c) : c);
            upperNext = c == ' ' || c == '-';
        }
        return out.toString();
    }
}
