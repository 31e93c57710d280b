package com.gigpulse.service.config;

import com.gigpulse.service.http.UpstreamTruststore;

import java.nio.file.Path;
import java.util.Map;
import java.util.function.Consumer;

public record ServiceEnvironment(
        String ticketmasterApiKey,
        String openWeatherApiKey,
        String googleMapsApiKey,
        String geocoderUserAgent,
        boolean geocodingEnabled,
        Integer portOverride,
        UpstreamTruststore truststore
) {
    static final String DEFAULT_GEOCODER_USER_AGENT = "gigpulse-forecaster/0.1 (contact: ops@gigpulse.app)";

    public static ServiceEnvironment from(Map<String, String> env, Consumer<String> warn) {
        String geocodingRaw = env.getOrDefault("GEOCODING_ENABLED", "true");
        boolean geocodingEnabled;
        if ("true".equalsIgnoreCase(geocodingRaw)) {
            geocodingEnabled = true;
        } else if ("false".equalsIgnoreCase(geocodingRaw)) {
            geocodingEnabled = false;
        } else {
            geocodingEnabled = true;
            warn.accept("Unknown GEOCODING_ENABLED=" + geocodingRaw + ", defaulting to true");
        }

        Integer port = null;
        String portRaw = env.get("PORT");
        if (portRaw != null && !portRaw.isBlank()) {
            try {
                int parsed = Integer.parseInt(portRaw.trim());
                if (parsed < 0 || parsed > 65_535) {
                    warn.accept("PORT=" + portRaw + " is out of range, using configured port");
                } else {
                    port = parsed;
                }
            } catch (NumberFormatException e) {
                warn.accept("PORT=" + portRaw + " is not a number, using configured port");
            }
        }

        UpstreamTruststore truststore = null;
        String truststorePath = env.get("TRUSTSTORE_PATH");
        if (truststorePath != null && !truststorePath.isBlank()) {
            String password = env.get("TRUSTSTORE_PASSWORD");
            if (password == null) {
                throw new IllegalStateException("TRUSTSTORE_PASSWORD must be set when TRUSTSTORE_PATH is configured");
            }
            truststore = new UpstreamTruststore(Path.of(truststorePath.trim()), password);
        }

        String userAgent = env.getOrDefault("GEOCODER_USER_AGENT", "");
        return new ServiceEnvironment(
                env.getOrDefault("TICKETMASTER_API_KEY", ""),
                env.getOrDefault("OPENWEATHER_API_KEY", ""),
                env.getOrDefault("GOOGLE_MAPS_API_KEY", ""),
                userAgent.isBlank() ? DEFAULT_GEOCODER_USER_AGENT : userAgent,
                geocodingEnabled,
                port,
                truststore
        );
    }
}
