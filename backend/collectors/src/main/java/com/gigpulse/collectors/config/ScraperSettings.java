package com.gigpulse.collectors.config;

public record ScraperSettings(
        boolean enabled,
        long timeoutMillis,
        long minDelayMillis,
        long ttlSeconds,
        int maxPages,
        int maxDetailFetches,
        String baseUrl
) {
    public ScraperSettings {
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("timeoutMillis must be > 0");
        }
        if (minDelayMillis < 0 || ttlSeconds < 0 || maxPages < 0 || maxDetailFetches < 0) {
            throw new IllegalArgumentException("Scraper limits must not be negative");
        }
    }

    public static ScraperSettings of(String baseUrl, long timeoutMillis, long minDelayMillis) {
        return new ScraperSettings(true, timeoutMillis, minDelayMillis, 900, 3, 10, baseUrl);
    }

    public ScraperSettings withBaseUrl(String url) {
        return new ScraperSettings(enabled, timeoutMillis, minDelayMillis, ttlSeconds, maxPages, maxDetailFetches, url);
    }

    public ScraperSettings withTimeoutMillis(long millis) {
        return new ScraperSettings(enabled, millis, minDelayMillis, ttlSeconds, maxPages, maxDetailFetches, baseUrl);
    }

    public ScraperSettings withTtlSeconds(long seconds) {
        return new ScraperSettings(enabled, timeoutMillis, minDelayMillis, seconds, maxPages, maxDetailFetches, baseUrl);
    }

    public ScraperSettings disabled() {
        return new ScraperSettings(false, timeoutMillis, minDelayMillis, ttlSeconds, maxPages, maxDetailFetches, baseUrl);
    }
}
