package com.gigpulse.core.location;

public record LocationQuery(String name, Double latitude, Double longitude) {
    public static LocationQuery ofName(String name) {
        return new LocationQuery(name, null, null);
    }

    public static LocationQuery ofCoordinates(double latitude, double longitude) {
        return new LocationQuery(null, latitude, longitude);
    }

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }
}
