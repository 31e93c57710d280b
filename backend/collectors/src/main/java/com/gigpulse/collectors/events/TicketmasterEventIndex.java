package com.gigpulse.collectors.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.gigpulse.collectors.api.ScrapeContext;
import com.gigpulse.collectors.config.ScraperSettings;
import com.gigpulse.collectors.http.SourceHttp;
import com.gigpulse.core.model.ResolvedLocation;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class TicketmasterEventIndex implements EventIndex {
    static final String DEFAULT_BASE_URL = "https://app.ticketmaster.com";
    private static final int PAGE_SIZE = 200;
    private static final LocalTime DATE_ONLY_START = LocalTime.NOON;

    private final ScraperSettings settings;
    private final String apiKey;

    public TicketmasterEventIndex(ScraperSettings settings, String apiKey) {
        this.settings = settings;
        this.apiKey = apiKey;
    }

    @Override
    public String name() {
        return "ticketmaster";
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public List<ListedEvent> eventsOn(ScrapeContext ctx, ResolvedLocation location, LocalDate date)
            throws IOException, InterruptedException {
        List<ListedEvent> events = new ArrayList<>();
        int totalPages = 1;
        for (int page = 0; page < totalPages && page < Math.max(1, settings.maxPages()); page++) {
            JsonNode root = SourceHttp.getJson(ctx, pageUri(location, date, page), Duration.ofMillis(settings.timeoutMillis()));
            totalPages = Math.max(1, root.path("page").path("totalPages").asInt(1));
            for (JsonNode node : root.path("_embedded").path("events")) {
                ListedEvent event = parseEvent(node);
                if (event != null) {
                    events.add(event);
                }
            }
        }
        return events;
    }

    URI pageUri(ResolvedLocation location, LocalDate date, int page) {
        String base = settings.baseUrl() == null || settings.baseUrl().isBlank() ? DEFAULT_BASE_URL : settings.baseUrl();
        String geoPoint = String.format(Locale.ROOT, "%.4f,%.4f", location.latitude(), location.longitude());
        String query = "apikey=" + encode(apiKey)
                + "&geoPoint=" + encode(geoPoint)
                + "&radius=25&unit=miles"
                + "&size=" + PAGE_SIZE
                + "&sort=" + encode("date,asc")
                + "&localStartDateTime=" + encode(date + "T00:00:00," + date + "T23:59:59")
                + "&page=" + page;
        return URI.create(base + "/discovery/v2/events.json?" + query);
    }

    static ListedEvent parseEvent(JsonNode node) {
        String id = node.path("id").asText("");
        LocalDateTime start = parseDateTime(node.path("dates").path("start"));
        if (id.isBlank() || start == null) {
            return null;
        }
        JsonNode venue = node.path("_embedded").path("venues").path(0);
        return new ListedEvent(
                id,
                node.path("name").asText(""),
                start,
                parseDateTime(node.path("dates").path("end")),
                estimateCapacity(node, venue),
                venue.path("name").asText(null)
        );
    }

    private static LocalDateTime parseDateTime(JsonNode when) {
        String localDate = when.path("localDate").asText("");
        if (localDate.isBlank()) {
            return null;
        }
        try {
            LocalDate date = LocalDate.parse(localDate);
            String localTime = when.path("localTime").asText("");
            return date.atTime(localTime.isBlank() ? DATE_ONLY_START : LocalTime.parse(localTime));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    // capacity is rarely published, so it is guessed from the venue type or classification
    static Integer estimateCapacity(JsonNode event, JsonNode venue) {
        if (venue.path("capacity").canConvertToInt() && venue.path("capacity").asInt() > 0) {
            return venue.path("capacity").asInt();
        }
        String venueType = venue.path("type").asText("").toLowerCase(Locale.ROOT);
        if (venueType.contains("stadium")) {
            return 50_000;
        }
        if (venueType.contains("arena")) {
            return 20_000;
        }
        JsonNode classification = event.path("classifications").path(0);
        if (classification.isMissingNode()) {
            return EventBoostCalculator.DEFAULT_CAPACITY;
        }
        String segment = classification.path("segment").path("name").asText("").toLowerCase(Locale.ROOT);
        String genre = classification.path("genre").path("name").asText("").toLowerCase(Locale.ROOT);
        if (segment.contains("sports") || segment.contains("music")) {
            return genre.contains("stadium") || genre.contains("arena") ? 20_000 : 5_000;
        }
        if (segment.contains("theatre") || segment.contains("theater") || segment.contains("comedy")) {
            return 1_500;
        }
        return 500;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
