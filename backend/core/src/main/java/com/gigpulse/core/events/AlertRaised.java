package com.gigpulse.core.events;

import java.time.Instant;
import java.util.Map;

public record AlertRaised(
        Instant timestamp,
        String category,
        String message,
        Map<String, Object> details
) implements Event {
    public static final String CATEGORY_SCRAPER = "scraper";
    public static final String CATEGORY_LOCATION = "location";
    public static final String CATEGORY_FORECAST = "forecast";

    @Override
    public String type() {
        return "AlertRaised";
    }
}
