package com.gigpulse.collectors.pricing;

import com.gigpulse.collectors.api.AbstractScraper;
import com.gigpulse.collectors.api.ScrapeContext;
import com.gigpulse.collectors.api.ScrapeException;
import com.gigpulse.collectors.api.ScrapeRequest;
import com.gigpulse.collectors.config.ScraperSettings;
import com.gigpulse.collectors.http.SourceHttp;
import com.gigpulse.core.model.PricingSignal;
import com.gigpulse.core.model.SignalSource;
import com.gigpulse.core.util.HtmlUtils;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public class PricingScraper extends AbstractScraper<PricingSignal> {
    static final String CITY_PLACEHOLDER = "{city}";
    static final double REFERENCE_BASE_FARE = 2.20;
    static final double MIN_ADJUSTMENT = 0.8;
    static final double MAX_ADJUSTMENT = 1.25;
    private static final int MIN_SAMPLES = 3;

    public PricingScraper(ScraperSettings settings) {
        super(settings);
    }

    @Override
    public SignalSource source() {
        return SignalSource.PRICING;
    }

    @Override
    public PricingSignal fallback(ScrapeRequest request) {
        return PricingSignal.unavailable();
    }

    @Override
    protected boolean isConfigured() {
        return settings.baseUrl() != null && settings.baseUrl().contains(CITY_PLACEHOLDER);
    }

    @Override
    protected String memoKey(ScrapeRequest request) {
        return request.location().city().key();
    }

    @Override
    protected PricingSignal load(ScrapeContext ctx, ScrapeRequest request) throws IOException, InterruptedException {
        String city = request.location().city().key().replace(' ', '-');
        String html = SourceHttp.getString(
                ctx,
                URI.create(settings.baseUrl().replace(CITY_PLACEHOLDER, city)),
                Duration.ofMillis(settings.timeoutMillis()),
                Map.of("Accept", "text/html")
        );
        double observed = medianBaseFare(html);
        double adjustment = Math.max(MIN_ADJUSTMENT, Math.min(MAX_ADJUSTMENT, observed / REFERENCE_BASE_FARE));
        return new PricingSignal(adjustment, observed, "fare_estimate", false);
    }

    static double medianBaseFare(String html) {
        List<Double> fares = new ArrayList<>();
        for (double amount : HtmlUtils.extractDollarAmounts(html, 2)) {
            if (amount >= 2.0 && amount <= 10.0) {
                fares.add(amount);
            }
        }
        if (fares.size() < MIN_SAMPLES) {
            throw new ScrapeException("Only " + fares.size() + " fare samples on page");
        }
        Collections.sort(fares);
        int middle = fares.size() / 2;
        return fares.size() % 2 == 1 ? fares.get(middle) : (fares.get(middle - 1) + fares.get(middle)) / 2.0;
    }
}
