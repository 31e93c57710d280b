package com.gigpulse.service.config;

import com.gigpulse.collectors.config.ScraperSettings;

import java.util.List;
import java.util.Map;

public record ForecasterConfig(
        int port,
        String defaultLocation,
        long cacheTtlSeconds,
        int cacheMaxEntries,
        long connectTimeoutMillis,
        int scraperThreads,
        int slotThreads,
        Map<String, ScraperSettings> sources
) {
    public static final String TICKETMASTER = "ticketmaster";
    public static final String EVENTBRITE = "eventbrite";
    public static final String EVENTS = "events";
    public static final String WEATHER = "weather";
    public static final String TRAFFIC = "traffic";
    public static final String FUEL = "fuel";
    public static final String PRICING = "pricing";
    public static final String GEOCODER = "geocoder";

    static final List<String> REQUIRED_SOURCES = List.of(
            TICKETMASTER, EVENTBRITE, EVENTS, WEATHER, TRAFFIC, FUEL, PRICING, GEOCODER
    );

    public ForecasterConfig {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (defaultLocation == null || defaultLocation.isBlank()) {
            throw new IllegalArgumentException("defaultLocation is required");
        }
        if (cacheTtlSeconds <= 0 || cacheMaxEntries <= 0 || connectTimeoutMillis <= 0) {
            throw new IllegalArgumentException("cacheTtlSeconds, cacheMaxEntries and connectTimeoutMillis must be > 0");
        }
        if (scraperThreads <= 0 || slotThreads <= 0) {
            throw new IllegalArgumentException("thread counts must be > 0");
        }
        sources = sources == null ? Map.of() : Map.copyOf(sources);
        for (String name : REQUIRED_SOURCES) {
            if (!sources.containsKey(name)) {
                throw new IllegalArgumentException("Missing settings for source '" + name + "'");
            }
        }
    }

    public ScraperSettings source(String name) {
        ScraperSettings settings = sources.get(name);
        if (settings == null) {
            throw new IllegalArgumentException("Unknown source '" + name + "'");
        }
        return settings;
    }

    public ForecasterConfig withPort(int newPort) {
        return new ForecasterConfig(newPort, defaultLocation, cacheTtlSeconds, cacheMaxEntries,
                connectTimeoutMillis, scraperThreads, slotThreads, sources);
    }
}
