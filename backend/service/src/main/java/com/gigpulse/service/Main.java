package com.gigpulse.service;

import com.gigpulse.collectors.api.ScrapeContext;
import com.gigpulse.collectors.api.SignalGatherer;
import com.gigpulse.collectors.config.ScraperSettings;
import com.gigpulse.collectors.events.EventDateResolver;
import com.gigpulse.collectors.events.EventScraper;
import com.gigpulse.collectors.events.EventbriteEventIndex;
import com.gigpulse.collectors.events.TicketmasterEventIndex;
import com.gigpulse.collectors.fuel.FuelPriceScraper;
import com.gigpulse.collectors.geo.NominatimGeocoder;
import com.gigpulse.collectors.http.HostRateLimiter;
import com.gigpulse.collectors.pricing.PricingScraper;
import com.gigpulse.collectors.traffic.TrafficScraper;
import com.gigpulse.collectors.weather.WeatherScraper;
import com.gigpulse.core.bus.EventBus;
import com.gigpulse.core.forecast.EarningsAggregator;
import com.gigpulse.core.forecast.ForecastTuning;
import com.gigpulse.core.forecast.ServiceCatalog;
import com.gigpulse.core.location.Geocoder;
import com.gigpulse.core.location.LocationResolver;
import com.gigpulse.core.location.ReferenceCityCatalog;
import com.gigpulse.service.api.ApiServer;
import com.gigpulse.service.api.DiagnosticsTracker;
import com.gigpulse.service.cache.InMemoryForecastCache;
import com.gigpulse.service.config.ConfigLoader;
import com.gigpulse.service.config.ForecasterConfig;
import com.gigpulse.service.config.ServiceEnvironment;
import com.gigpulse.service.forecast.ForecastService;
import com.gigpulse.service.http.HttpClientFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        Path configDir = Path.of(args.length > 0 ? args[0] : "config");
        ServiceEnvironment env = ServiceEnvironment.from(System.getenv(), LOGGER::warning);
        ForecasterConfig config = ConfigLoader.loadForecaster(configDir);
        if (env.portOverride() != null) {
            config = config.withPort(env.portOverride());
        }

        Clock clock = Clock.systemDefaultZone();
        EventBus eventBus = new EventBus();
        ExecutorService scraperExecutor = Executors.newFixedThreadPool(config.scraperThreads());
        ExecutorService slotExecutor = Executors.newFixedThreadPool(config.slotThreads());
        HttpClient httpClient = HttpClientFactory.create(config, env);

        HostRateLimiter rateLimiter = new HostRateLimiter(clock);
        for (String source : List.of(ForecasterConfig.TICKETMASTER, ForecasterConfig.EVENTBRITE, ForecasterConfig.WEATHER,
                ForecasterConfig.TRAFFIC, ForecasterConfig.FUEL, ForecasterConfig.PRICING, ForecasterConfig.GEOCODER)) {
            configureRateLimit(rateLimiter, config.source(source));
        }
        ScrapeContext scrapeContext = new ScrapeContext(httpClient, eventBus, clock, scraperExecutor, rateLimiter);

        ReferenceCityCatalog cities = ConfigLoader.loadReferenceCities(configDir);
        ScraperSettings geocoderSettings = config.source(ForecasterConfig.GEOCODER);
        Geocoder geocoder = env.geocodingEnabled()
                ? new NominatimGeocoder(scrapeContext, geocoderSettings, env.geocoderUserAgent())
                : Geocoder.NONE;
        LocationResolver resolver = new LocationResolver(cities, geocoder, config.defaultLocation());

        ForecastTuning tuning = ConfigLoader.loadTuning(configDir);
        SignalGatherer gatherer = new SignalGatherer(
                scrapeContext,
                new EventScraper(
                        config.source(ForecasterConfig.EVENTS),
                        List.of(
                                new TicketmasterEventIndex(config.source(ForecasterConfig.TICKETMASTER), env.ticketmasterApiKey()),
                                new EventbriteEventIndex(config.source(ForecasterConfig.EVENTBRITE), new EventDateResolver(500))
                        ),
                        tuning.eventDemand()
                ),
                new WeatherScraper(config.source(ForecasterConfig.WEATHER), env.openWeatherApiKey()),
                new TrafficScraper(config.source(ForecasterConfig.TRAFFIC), env.googleMapsApiKey()),
                new FuelPriceScraper(config.source(ForecasterConfig.FUEL)),
                new PricingScraper(config.source(ForecasterConfig.PRICING))
        );

        ServiceCatalog catalog = ConfigLoader.loadServiceCatalog(configDir);
        EarningsAggregator aggregator = new EarningsAggregator(tuning, catalog, eventBus, clock);
        InMemoryForecastCache cache = new InMemoryForecastCache(
                clock,
                Duration.ofSeconds(config.cacheTtlSeconds()),
                config.cacheMaxEntries()
        );
        ForecastService forecastService = new ForecastService(
                resolver,
                gatherer,
                aggregator,
                cache,
                eventBus,
                clock,
                slotExecutor
        );

        DiagnosticsTracker diagnosticsTracker = new DiagnosticsTracker(eventBus, clock);
        ApiServer apiServer = new ApiServer(config.port(), forecastService, diagnosticsTracker, clock);
        apiServer.start();
        LOGGER.info("Forecaster started with default location " + config.defaultLocation()
                + ", cache TTL " + config.cacheTtlSeconds() + "s");

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutting down forecaster");
            apiServer.stop();
            cache.close();
            slotExecutor.shutdownNow();
            scraperExecutor.shutdownNow();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Could not read logging.properties, keeping JVM defaults: " + e.getMessage());
        }
    }

    private static void configureRateLimit(HostRateLimiter rateLimiter, ScraperSettings settings) {
        if (settings.baseUrl() == null || settings.baseUrl().isBlank() || settings.minDelayMillis() == 0) {
            return;
        }
        String host = URI.create(settings.baseUrl().replace("{city}", "city")).getHost();
        if (host != null) {
            rateLimiter.configure(host, Duration.ofMillis(settings.minDelayMillis()));
        }
    }
}
