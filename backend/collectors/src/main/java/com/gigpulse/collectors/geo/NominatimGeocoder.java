package com.gigpulse.collectors.geo;

import com.fasterxml.jackson.databind.JsonNode;
import com.gigpulse.collectors.api.ScrapeContext;
import com.gigpulse.collectors.api.ScrapeException;
import com.gigpulse.collectors.config.ScraperSettings;
import com.gigpulse.collectors.http.SourceHttp;
import com.gigpulse.core.location.Coordinates;
import com.gigpulse.core.location.Geocoder;
import com.gigpulse.core.util.JsonUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

public final class NominatimGeocoder implements Geocoder {
    private static final Logger LOGGER = Logger.getLogger(NominatimGeocoder.class.getName());
    static final String DEFAULT_BASE_URL = "https://nominatim.openstreetmap.org";

    private final ScrapeContext ctx;
    private final ScraperSettings settings;
    private final String userAgent;

    public NominatimGeocoder(ScrapeContext ctx, ScraperSettings settings, String userAgent) {
        this.ctx = ctx;
        this.settings = settings;
        this.userAgent = userAgent;
    }

    @Override
    public Optional<Coordinates> forward(String query) {
        URI uri = URI.create(baseUrl() + "/search?format=json&limit=1&countrycodes=us&q="
                + URLEncoder.encode(query, StandardCharsets.UTF_8));
        return lookup(uri, "forward geocode '" + query + "'").flatMap(root -> {
            JsonNode first = root.path(0);
            if (!first.hasNonNull("lat") || !first.hasNonNull("lon")) {
                return Optional.empty();
            }
            try {
                return Optional.of(new Coordinates(first.get("lat").asDouble(), first.get("lon").asDouble()));
            } catch (IllegalArgumentException e) {
                LOGGER.warning("Ignoring out-of-range result for '" + query + "': " + e.getMessage());
                return Optional.empty();
            }
        });
    }

    @Override
    public Optional<String> reverse(double latitude, double longitude) {
        URI uri = URI.create(String.format(
                Locale.ROOT,
                "%s/reverse?format=json&zoom=10&lat=%.4f&lon=%.4f",
                baseUrl(),
                latitude,
                longitude
        ));
        return lookup(uri, "reverse geocode " + latitude + "," + longitude).flatMap(root -> {
            JsonNode address = root.path("address");
            for (String field : new String[]{"city", "town", "village", "county"}) {
                String value = address.path(field).asText("");
                if (!value.isBlank()) {
                    return Optional.of(value);
                }
            }
            return Optional.empty();
        });
    }

    private Optional<JsonNode> lookup(URI uri, String description) {
        if (!settings.enabled()) {
            return Optional.empty();
        }
        try {
            String body = SourceHttp.getString(
                    ctx.withDeadline(ctx.clock().instant().plusMillis(settings.timeoutMillis())),
                    uri,
                    Duration.ofMillis(settings.timeoutMillis()),
                    Map.of("User-Agent", userAgent, "Accept", "application/json")
            );
            return Optional.of(JsonUtils.readTree(body));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warning("Interrupted during " + description);
            return Optional.empty();
        } catch (IOException | UncheckedIOException | ScrapeException e) {
            LOGGER.warning("Failed to " + description + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    private String baseUrl() {
        return settings.baseUrl() == null || settings.baseUrl().isBlank() ? DEFAULT_BASE_URL : settings.baseUrl();
    }
}
