package com.gigpulse.service.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.gigpulse.core.location.LocationQuery;
import com.gigpulse.core.model.ServiceId;
import com.gigpulse.core.model.SlotForecast;
import com.gigpulse.core.model.TimeSlot;
import com.gigpulse.core.util.JsonUtils;
import com.gigpulse.service.forecast.ForecastService;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    private static final DiagnosticsTracker EMPTY_DIAGNOSTICS = DiagnosticsTracker.empty();
    static final int WEEK_DAYS = 7;
    static final int WEEK_FIRST_HOUR = 6;
    static final int WEEK_LAST_HOUR = 23;

    private final int port;
    private final ForecastService forecastService;
    private final DiagnosticsTracker diagnosticsTracker;
    private final Clock clock;
    private final int threads;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(int port, ForecastService forecastService, DiagnosticsTracker diagnosticsTracker, Clock clock) {
        this(port, forecastService, diagnosticsTracker, clock, 16);
    }

    public ApiServer(
            int port,
            ForecastService forecastService,
            DiagnosticsTracker diagnosticsTracker,
            Clock clock,
            int threads
    ) {
        this.port = port;
        this.forecastService = forecastService;
        this.diagnosticsTracker = diagnosticsTracker;
        this.clock = clock;
        this.threads = threads;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newFixedThreadPool(threads);
            server.setExecutor(executor);
            server.createContext("/api/health", exchange -> handle(exchange, "GET", this::handleHealth));
            server.createContext("/api/earnings", exchange -> handle(exchange, "GET", this::handleEarnings));
            server.createContext("/api/earnings/lightweight", exchange -> handle(exchange, "GET", this::handleLightweight));
            server.createContext("/api/earnings/batch", exchange -> handle(exchange, "POST", this::handleBatch));
            server.createContext("/api/earnings/week", exchange -> handle(exchange, "GET", this::handleWeek));
            server.createContext("/api/sources/status", exchange -> handle(exchange, "GET", this::handleSourcesStatus));
            server.start();
            LOGGER.info("API server listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        writeJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleEarnings(HttpExchange exchange) throws IOException {
        SlotQuery query = RequestParsing.slotQuery(RequestParsing.queryParams(exchange.getRequestURI()), today());
        SlotForecast forecast = forecastService.forecast(query.location(), query.slot());
        writeJson(exchange, 200, EarningsResponse.from(forecast, query.timeSlotLabel(), query.services(), false));
    }

    private void handleLightweight(HttpExchange exchange) throws IOException {
        SlotQuery query = RequestParsing.slotQuery(RequestParsing.queryParams(exchange.getRequestURI()), today());
        SlotForecast forecast = forecastService.lightweight(query.location(), query.slot());
        writeJson(exchange, 200, EarningsResponse.from(forecast, query.timeSlotLabel(), query.services(), true));
    }

    private void handleBatch(HttpExchange exchange) throws IOException {
        BatchRequest request = readBody(exchange, BatchRequest.class);
        LocationQuery location = RequestParsing.locationFromBody(request.location(), request.lat(), request.lng());
        LocalDate date = RequestParsing.date(request.date(), today());
        Set<ServiceId> services = RequestParsing.services(request.service());
        List<BatchRequest.TimeSlotRequest> slots = request.timeSlots() == null ? List.of() : request.timeSlots();

        List<Integer> hours = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        for (BatchRequest.TimeSlotRequest slot : slots) {
            if (slot == null) {
                throw new BadRequestException("timeSlots must not contain null entries");
            }
            int hour = RequestParsing.hour(slot.startTime());
            hours.add(hour);
            labels.add(RequestParsing.timeSlotLabel(slot.startTime(), slot.endTime(), new TimeSlot(date, hour)));
        }

        List<SlotForecast> forecasts = forecastService.batch(location, date, hours);
        List<EarningsResponse> results = new ArrayList<>();
        for (int i = 0; i < forecasts.size(); i++) {
            results.add(EarningsResponse.from(forecasts.get(i), labels.get(i), services, false));
        }
        String label = forecasts.isEmpty() ? request.location() : forecasts.get(0).locationLabel();
        writeJson(exchange, 200, new BatchResponse(label, date, results));
    }

    private void handleWeek(HttpExchange exchange) throws IOException {
        Map<String, String> params = RequestParsing.queryParams(exchange.getRequestURI());
        LocationQuery location = RequestParsing.location(params.get("location"), params.get("lat"), params.get("lng"));
        LocalDate startDate = RequestParsing.date(
                params.get("startDate"),
                today().with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
        );
        Set<ServiceId> services = RequestParsing.services(params.get("service"));

        Map<LocalDate, Map<Integer, SlotForecast>> week =
                forecastService.week(location, startDate, WEEK_DAYS, WEEK_FIRST_HOUR, WEEK_LAST_HOUR);
        Map<String, Map<String, List<EarningsResponse.Prediction>>> weekData = new LinkedHashMap<>();
        String label = null;
        for (Map.Entry<LocalDate, Map<Integer, SlotForecast>> day : week.entrySet()) {
            Map<String, List<EarningsResponse.Prediction>> hours = new LinkedHashMap<>();
            for (Map.Entry<Integer, SlotForecast> hour : day.getValue().entrySet()) {
                hours.put(String.valueOf(hour.getKey()), EarningsResponse.predictions(hour.getValue(), services));
                label = hour.getValue().locationLabel();
            }
            weekData.put(day.getKey().getDayOfWeek().name().toLowerCase(Locale.ROOT), hours);
        }
        writeJson(exchange, 200, new WeekResponse(label, startDate, weekData));
    }

    private void handleSourcesStatus(HttpExchange exchange) throws IOException {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("sources", diagnostics().sourcesSnapshot());
        status.put("forecasts", diagnostics().metricsSnapshot());
        status.put("cache", forecastService.cacheStats());
        writeJson(exchange, 200, status);
    }

    private void handle(HttpExchange exchange, String method, Handler handler) throws IOException {
        try {
            if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
                exchange.getResponseHeaders().set("Access-Control-Allow-Methods", method + ",OPTIONS");
                exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
                exchange.sendResponseHeaders(204, -1);
                return;
            }
            if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.sendResponseHeaders(405, -1);
                return;
            }
            if (!exchange.getRequestURI().getPath().equals(exchange.getHttpContext().getPath())) {
                writeJson(exchange, 404, Map.of("error", "not_found"));
                return;
            }
            handler.handle(exchange);
        } catch (BadRequestException e) {
            writeJson(exchange, 400, Map.of("error", "invalid_request", "message", e.getMessage()));
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Unhandled failure serving " + exchange.getRequestURI(), e);
            writeJson(exchange, 500, Map.of("error", "internal_error"));
        } finally {
            exchange.close();
        }
    }

    private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            T body = JsonUtils.objectMapper().readValue(in, type);
            if (body == null) {
                throw new BadRequestException("Request body is required");
            }
            return body;
        } catch (JsonProcessingException e) {
            throw new BadRequestException("Malformed JSON body: " + e.getOriginalMessage());
        }
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private DiagnosticsTracker diagnostics() {
        return diagnosticsTracker != null ? diagnosticsTracker : EMPTY_DIAGNOSTICS;
    }

    @FunctionalInterface
    private interface Handler {
        void handle(HttpExchange exchange) throws IOException;
    }
}
