package com.gigpulse.collectors.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gigpulse.collectors.api.ScrapeContext;
import com.gigpulse.collectors.api.ScrapeException;
import com.gigpulse.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

public final class SourceHttp {
    public static final String USER_AGENT = "Mozilla/5.0 (compatible; GigPulse/1.0; +https://gigpulse.app)";

    private SourceHttp() {
    }

    public static String getString(ScrapeContext ctx, URI uri, Duration timeout, Map<String, String> headers)
            throws IOException, InterruptedException {
        int attempts = 0;
        while (true) {
            attempts++;
            ctx.rateLimiter().acquire(uri.getHost(), ctx.deadline());
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                    .GET()
                    .timeout(timeout);
            if (!headers.containsKey("User-Agent")) {
                builder.header("User-Agent", USER_AGENT);
            }
            headers.forEach(builder::header);
            HttpResponse<String> response = ctx.httpClient().send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 == 2) {
                return response.body();
            }
            if (attempts >= 2 || response.statusCode() < 500) {
                throw new ScrapeException("HTTP status " + response.statusCode() + " from " + uri.getHost());
            }
        }
    }

    public static JsonNode getJson(ScrapeContext ctx, URI uri, Duration timeout) throws IOException, InterruptedException {
        String body = getString(ctx, uri, timeout, Map.of("Accept", "application/json"));
        try {
            return JsonUtils.objectMapper().readTree(body);
        } catch (JsonProcessingException e) {
            throw new ScrapeException("Malformed JSON from " + uri.getHost(), e);
        }
    }
}
