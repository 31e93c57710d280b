package com.gigpulse.collectors.events;

import com.gigpulse.collectors.api.ScrapeContext;
import com.gigpulse.collectors.api.ScrapeException;
import com.gigpulse.collectors.config.ScraperSettings;
import com.gigpulse.collectors.http.SourceHttp;
import com.gigpulse.core.model.ResolvedLocation;
import com.gigpulse.core.util.HtmlUtils;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class EventbriteEventIndex implements EventIndex {
    private static final Logger LOGGER = Logger.getLogger(EventbriteEventIndex.class.getName());
    static final String DEFAULT_BASE_URL = "https://www.eventbrite.com";
    private static final Pattern EVENT_LINK = Pattern.compile("/e/([^/\\s?]+)-(\\d{10,})");

    private final ScraperSettings settings;
    private final EventDateResolver dateResolver;

    public EventbriteEventIndex(ScraperSettings settings, EventDateResolver dateResolver) {
        this.settings = settings;
        this.dateResolver = dateResolver;
    }

    @Override
    public String name() {
        return "eventbrite";
    }

    @Override
    public boolean isConfigured() {
        return true;
    }

    @Override
    public List<ListedEvent> eventsOn(ScrapeContext ctx, ResolvedLocation location, LocalDate date)
            throws IOException, InterruptedException {
        Duration timeout = Duration.ofMillis(settings.timeoutMillis());
        Map<String, ListedEvent> byId = new LinkedHashMap<>();
        for (int page = 1; page <= Math.max(1, settings.maxPages()); page++) {
            URI pageUri = pageUri(location, date, page);
            Map<String, String> links = eventLinks(SourceHttp.getString(ctx, pageUri, timeout, Map.of()));
            if (links.isEmpty()) {
                break;
            }
            int detailFetches = 0;
            for (Map.Entry<String, String> link : links.entrySet()) {
                String id = link.getKey();
                if (byId.containsKey(id)) {
                    continue;
                }
                Optional<LocalDateTime> start = dateResolver.cached(id);
                if (start.isEmpty() && detailFetches < settings.maxDetailFetches()) {
                    detailFetches++;
                    start = resolveDate(ctx, id, pageUri.resolve(link.getValue()), timeout);
                }
                // unconfirmed events are taken at the date the listing was filtered to
                LocalDateTime when = start.orElse(date.atTime(LocalTime.NOON));
                byId.put(id, new ListedEvent(id, nameFromSlug(link.getValue()), when, null, null, null));
            }
        }
        return new ArrayList<>(byId.values());
    }

    private Optional<LocalDateTime> resolveDate(ScrapeContext ctx, String id, URI eventPage, Duration timeout)
            throws InterruptedException {
        try {
            return dateResolver.resolve(ctx, id, eventPage, timeout);
        } catch (IOException | ScrapeException e) {
            LOGGER.fine("Could not confirm date of Eventbrite event " + id + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    URI pageUri(ResolvedLocation location, LocalDate date, int page) {
        String base = settings.baseUrl() == null || settings.baseUrl().isBlank() ? DEFAULT_BASE_URL : settings.baseUrl();
        String place = location.city().stateCode().toLowerCase(Locale.ROOT) + "--" + slug(location.label());
        String query = "start_date=" + date + "&end_date=" + date + (page > 1 ? "&page=" + page : "");
        return URI.create(base + "/d/" + place + "/all-events/?" + query);
    }

    static Map<String, String> eventLinks(String html) {
        Map<String, String> links = new LinkedHashMap<>();
        for (String href : HtmlUtils.extractLinks(html)) {
            Matcher matcher = EVENT_LINK.matcher(href);
            if (matcher.find()) {
                links.putIfAbsent(matcher.group(2), href);
            }
        }
        return links;
    }

    static String nameFromSlug(String href) {
        Matcher matcher = EVENT_LINK.matcher(href);
        if (!matcher.find()) {
            return "";
        }
        String slug = matcher.group(1).replaceAll("-tickets$", "");
        return slug.replace('-', ' ');
    }

    static String slug(String label) {
        return label.trim()
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-|-$)", "");
    }
}
