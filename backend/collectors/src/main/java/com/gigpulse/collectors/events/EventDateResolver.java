package com.gigpulse.collectors.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.gigpulse.collectors.api.ScrapeContext;
import com.gigpulse.collectors.http.SourceHttp;
import com.gigpulse.core.util.HtmlUtils;
import com.gigpulse.core.util.JsonUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public final class EventDateResolver {
    private final Map<String, LocalDateTime> cache;

    public EventDateResolver(int capacity) {
        this.cache = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, LocalDateTime> eldest) {
                return size() > capacity;
            }
        });
    }

    public Optional<LocalDateTime> cached(String eventId) {
        return Optional.ofNullable(cache.get(eventId));
    }

    public Optional<LocalDateTime> resolve(ScrapeContext ctx, String eventId, URI eventPage, Duration timeout)
            throws IOException, InterruptedException {
        LocalDateTime known = cache.get(eventId);
        if (known != null) {
            return Optional.of(known);
        }
        Optional<LocalDateTime> start = parseStart(SourceHttp.getString(ctx, eventPage, timeout, Map.of()));
        start.ifPresent(value -> cache.put(eventId, value));
        return start;
    }

    public int size() {
        return cache.size();
    }

    static Optional<LocalDateTime> parseStart(String html) {
        for (String block : HtmlUtils.extractJsonLdBlocks(html)) {
            JsonNode root;
            try {
                root = JsonUtils.readTree(block);
            } catch (UncheckedIOException e) {
                continue;
            }
            Optional<LocalDateTime> found = findStartDate(root);
            if (found.isPresent()) {
                return found;
            }
        }
        return HtmlUtils.extractFirstTimeDatetime(html).flatMap(EventDateResolver::parseDateTime);
    }

    private static Optional<LocalDateTime> findStartDate(JsonNode node) {
        if (node.isArray()) {
            for (JsonNode item : node) {
                Optional<LocalDateTime> found = findStartDate(item);
                if (found.isPresent()) {
                    return found;
                }
            }
            return Optional.empty();
        }
        if (node.hasNonNull("startDate")) {
            return parseDateTime(node.get("startDate").asText());
        }
        if (node.has("@graph")) {
            return findStartDate(node.get("@graph"));
        }
        return Optional.empty();
    }

    static Optional<LocalDateTime> parseDateTime(String raw) {
        String value = raw.trim();
        try {
            return Optional.of(OffsetDateTime.parse(value).toLocalDateTime());
        } catch (DateTimeParseException ignored) {
            // not offset-qualified; try the local forms below
        }
        try {
            return Optional.of(LocalDateTime.parse(value));
        } catch (DateTimeParseException ignored) {
            // date only, or garbage
        }
        try {
            return Optional.of(LocalDate.parse(value).atTime(LocalTime.NOON));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
