package com.gigpulse.collectors.fuel;

import com.gigpulse.collectors.api.AbstractScraper;
import com.gigpulse.collectors.api.ScrapeContext;
import com.gigpulse.collectors.api.ScrapeException;
import com.gigpulse.collectors.api.ScrapeRequest;
import com.gigpulse.collectors.config.ScraperSettings;
import com.gigpulse.collectors.http.SourceHttp;
import com.gigpulse.core.model.FuelPriceSignal;
import com.gigpulse.core.model.SignalSource;
import com.gigpulse.core.util.HtmlUtils;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class FuelPriceScraper extends AbstractScraper<FuelPriceSignal> {
    static final String DEFAULT_BASE_URL = "https://gasprices.aaa.com";
    static final double MIN_PLAUSIBLE = 2.50;
    static final double MAX_PLAUSIBLE = 7.00;

    public FuelPriceScraper(ScraperSettings settings) {
        super(settings);
    }

    @Override
    public SignalSource source() {
        return SignalSource.FUEL;
    }

    @Override
    public FuelPriceSignal fallback(ScrapeRequest request) {
        return FuelPriceSignal.unavailable(request.location().city().stateCode());
    }

    // prices move daily at most, so one reading serves the whole state
    @Override
    protected String memoKey(ScrapeRequest request) {
        return request.location().city().stateCode();
    }

    @Override
    protected FuelPriceSignal load(ScrapeContext ctx, ScrapeRequest request) throws IOException, InterruptedException {
        String state = request.location().city().stateCode().toUpperCase(Locale.ROOT);
        String base = settings.baseUrl() == null || settings.baseUrl().isBlank() ? DEFAULT_BASE_URL : settings.baseUrl();
        String html = SourceHttp.getString(
                ctx,
                URI.create(base + "/?state=" + state),
                Duration.ofMillis(settings.timeoutMillis()),
                Map.of("Accept", "text/html")
        );
        return new FuelPriceSignal(averagePrice(html), "aaa", false);
    }

    static double averagePrice(String html) {
        List<Double> prices = HtmlUtils.extractDollarAmounts(html, 3).stream()
                .filter(price -> price >= MIN_PLAUSIBLE && price <= MAX_PLAUSIBLE)
                .toList();
        if (prices.isEmpty()) {
            throw new ScrapeException("No plausible fuel prices on page");
        }
        double sum = 0.0;
        for (double price : prices) {
            sum += price;
        }
        return Math.round(sum / prices.size() * 1000.0) / 1000.0;
    }
}
