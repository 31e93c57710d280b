package com.gigpulse.collectors.traffic;

import com.fasterxml.jackson.databind.JsonNode;
import com.gigpulse.collectors.api.AbstractScraper;
import com.gigpulse.collectors.api.ScrapeContext;
import com.gigpulse.collectors.api.ScrapeException;
import com.gigpulse.collectors.api.ScrapeRequest;
import com.gigpulse.collectors.config.ScraperSettings;
import com.gigpulse.collectors.http.SourceHttp;
import com.gigpulse.core.model.SignalSource;
import com.gigpulse.core.model.TrafficSignal;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

public class TrafficScraper extends AbstractScraper<TrafficSignal> {
    static final String DEFAULT_BASE_URL = "https://maps.googleapis.com";
    // roughly 3 km north-east of the centre
    private static final double PROBE_OFFSET_DEGREES = 0.02;

    private final String apiKey;

    public TrafficScraper(ScraperSettings settings, String apiKey) {
        super(settings);
        this.apiKey = apiKey;
    }

    @Override
    public SignalSource source() {
        return SignalSource.TRAFFIC;
    }

    @Override
    public TrafficSignal fallback(ScrapeRequest request) {
        return TrafficSignal.unavailable(request.hour());
    }

    @Override
    protected boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    protected String memoKey(ScrapeRequest request) {
        return request.location().key() + "|" + request.slot().date() + "|" + request.hour();
    }

    @Override
    protected TrafficSignal load(ScrapeContext ctx, ScrapeRequest request) throws IOException, InterruptedException {
        double lat = request.location().latitude();
        double lng = request.location().longitude();
        Instant departure = request.slot().date()
                .atTime(request.hour(), 0)
                .atZone(ctx.clock().getZone())
                .toInstant();
        // the API only accepts departure times that are not in the past
        long departureTime = Math.max(departure.getEpochSecond(), ctx.clock().instant().getEpochSecond());

        String base = settings.baseUrl() == null || settings.baseUrl().isBlank() ? DEFAULT_BASE_URL : settings.baseUrl();
        URI uri = URI.create(String.format(
                Locale.ROOT,
                "%s/maps/api/distancematrix/json?origins=%.4f,%.4f&destinations=%.4f,%.4f&departure_time=%d&key=%s",
                base,
                lat,
                lng,
                lat + PROBE_OFFSET_DEGREES,
                lng + PROBE_OFFSET_DEGREES,
                departureTime,
                apiKey
        ));
        JsonNode root = SourceHttp.getJson(ctx, uri, Duration.ofMillis(settings.timeoutMillis()));
        if (!"OK".equals(root.path("status").asText())) {
            throw new ScrapeException("Distance Matrix status " + root.path("status").asText("missing"));
        }
        JsonNode element = root.path("rows").path(0).path("elements").path(0);
        double freeFlow = element.path("duration").path("value").asDouble(0);
        double inTraffic = element.path("duration_in_traffic").path("value").asDouble(0);
        if (freeFlow <= 0 || inTraffic <= 0) {
            throw new ScrapeException("Distance Matrix element has no durations");
        }
        return new TrafficSignal(inTraffic / freeFlow - 1.0, "google_distance_matrix", false);
    }
}
