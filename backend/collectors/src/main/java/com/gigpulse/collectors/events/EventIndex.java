package com.gigpulse.collectors.events;

import com.gigpulse.collectors.api.ScrapeContext;
import com.gigpulse.core.model.ResolvedLocation;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

public interface EventIndex {
    String name();

    boolean isConfigured();

    List<ListedEvent> eventsOn(ScrapeContext ctx, ResolvedLocation location, LocalDate date)
            throws IOException, InterruptedException;
}
