package com.gigpulse.collectors.weather;

import com.fasterxml.jackson.databind.JsonNode;
import com.gigpulse.collectors.api.AbstractScraper;
import com.gigpulse.collectors.api.ScrapeContext;
import com.gigpulse.collectors.api.ScrapeException;
import com.gigpulse.collectors.api.ScrapeRequest;
import com.gigpulse.collectors.config.ScraperSettings;
import com.gigpulse.collectors.http.SourceHttp;
import com.gigpulse.collectors.http.TtlMemo;
import com.gigpulse.core.model.ResolvedLocation;
import com.gigpulse.core.model.SignalSource;
import com.gigpulse.core.model.WeatherSignal;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

public class WeatherScraper extends AbstractScraper<WeatherSignal> {
    static final String DEFAULT_BASE_URL = "https://api.openweathermap.org";
    static final int FORECAST_HORIZON_DAYS = 5;

    private final String apiKey;
    private final TtlMemo<JsonNode> payloads;

    public WeatherScraper(ScraperSettings settings, String apiKey) {
        super(settings);
        this.apiKey = apiKey;
        this.payloads = new TtlMemo<>(Duration.ofSeconds(settings.ttlSeconds()));
    }

    @Override
    public SignalSource source() {
        return SignalSource.WEATHER;
    }

    @Override
    public WeatherSignal fallback(ScrapeRequest request) {
        return WeatherSignal.unavailable();
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
    protected WeatherSignal load(ScrapeContext ctx, ScrapeRequest request) throws IOException, InterruptedException {
        LocalDate today = LocalDate.now(ctx.clock());
        long daysAhead = ChronoUnit.DAYS.between(today, request.slot().date());
        if (daysAhead < 0 || daysAhead > FORECAST_HORIZON_DAYS) {
            throw new ScrapeException("No weather data " + daysAhead + " days from today");
        }

        if (daysAhead == 0) {
            JsonNode current = payload(ctx, request.location(), "weather", today);
            return toSignal(current.path("main").path("temp"), current.path("weather"), current);
        }

        JsonNode forecast = payload(ctx, request.location(), "forecast", today);
        Instant target = request.slot().date()
                .atTime(request.hour(), 0)
                .atZone(ctx.clock().getZone())
                .toInstant();
        JsonNode closest = null;
        long bestGap = Long.MAX_VALUE;
        for (JsonNode entry : forecast.path("list")) {
            long gap = Math.abs(entry.path("dt").asLong() - target.getEpochSecond());
            if (gap < bestGap) {
                bestGap = gap;
                closest = entry;
            }
        }
        if (closest == null) {
            throw new ScrapeException("Weather forecast has no entries");
        }
        return toSignal(closest.path("main").path("temp"), closest.path("weather"), closest);
    }

    private JsonNode payload(ScrapeContext ctx, ResolvedLocation location, String endpoint, LocalDate today)
            throws IOException, InterruptedException {
        String key = endpoint + "|" + location.key() + "|" + today;
        JsonNode cached = payloads.get(key, ctx.clock().instant()).orElse(null);
        if (cached != null) {
            return cached;
        }
        String base = settings.baseUrl() == null || settings.baseUrl().isBlank() ? DEFAULT_BASE_URL : settings.baseUrl();
        URI uri = URI.create(String.format(
                Locale.ROOT,
                "%s/data/2.5/%s?lat=%.4f&lon=%.4f&units=imperial&appid=%s",
                base,
                endpoint,
                location.latitude(),
                location.longitude(),
                apiKey
        ));
        JsonNode body = SourceHttp.getJson(ctx, uri, Duration.ofMillis(settings.timeoutMillis()));
        payloads.put(key, body, ctx.clock().instant());
        return body;
    }

    private static WeatherSignal toSignal(JsonNode temperature, JsonNode conditions, JsonNode entry) {
        if (!temperature.isNumber()) {
            throw new ScrapeException("Weather payload has no temperature");
        }
        String main = conditions.path(0).path("main").asText("Clear");
        boolean precipitation = entry.has("rain") || entry.has("snow");
        double tempF = temperature.asDouble();
        return new WeatherSignal(multiplier(main, tempF, precipitation), tempF, main, "openweathermap", false);
    }

    static double multiplier(String conditions, double temperatureF, boolean precipitation) {
        String lowered = conditions.toLowerCase(Locale.ROOT);
        if (lowered.contains("snow")) {
            return 1.5;
        }
        if (lowered.contains("rain") || lowered.contains("drizzle") || lowered.contains("thunderstorm") || precipitation) {
            return 1.4;
        }
        if (temperatureF < 40 || temperatureF > 85) {
            return 1.2;
        }
        return 1.0;
    }
}
