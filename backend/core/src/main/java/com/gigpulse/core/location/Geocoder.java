package com.gigpulse.core.location;

import java.util.Optional;

public interface Geocoder {
    Geocoder NONE = new Geocoder() {
        @Override
        public Optional<Coordinates> forward(String query) {
            return Optional.empty();
        }

        @Override
        public Optional<String> reverse(double latitude, double longitude) {
            return Optional.empty();
        }
    };

    Optional<Coordinates> forward(String query);

    Optional<String> reverse(double latitude, double longitude);
}
