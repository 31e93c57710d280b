package com.gigpulse.service.api;

import com.gigpulse.core.location.LocationQuery;
import com.gigpulse.core.model.ServiceId;
import com.gigpulse.core.model.TimeSlot;
import com.gigpulse.core.util.HourFormat;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

final class RequestParsing {
    static final int DEFAULT_START_HOUR = 9;

    private RequestParsing() {
    }

    static Map<String, String> queryParams(URI uri) {
        Map<String, String> query = new HashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            if (entry.isEmpty()) {
                continue;
            }
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.put(key, value);
        }
        return query;
    }

    static SlotQuery slotQuery(Map<String, String> params, LocalDate today) {
        LocalDate date = date(params.get("date"), today);
        String startTime = params.get("startTime");
        String endTime = params.get("endTime");
        int hour = hour(startTime);
        TimeSlot slot = new TimeSlot(date, hour);
        return new SlotQuery(
                location(params.get("location"), params.get("lat"), params.get("lng")),
                slot,
                timeSlotLabel(startTime, endTime, slot),
                services(params.get("service"))
        );
    }

    static LocationQuery location(String name, String lat, String lng) {
        boolean hasLat = lat != null && !lat.isBlank();
        boolean hasLng = lng != null && !lng.isBlank();
        if (hasLat != hasLng) {
            throw new BadRequestException("lat and lng must be given together");
        }
        if (hasLat) {
            return LocationQuery.ofCoordinates(
                    coordinate("lat", lat, 90),
                    coordinate("lng", lng, 180)
            );
        }
        return LocationQuery.ofName(name);
    }

    static LocationQuery locationFromBody(String name, Double lat, Double lng) {
        if ((lat == null) != (lng == null)) {
            throw new BadRequestException("lat and lng must be given together");
        }
        if (lat != null) {
            return LocationQuery.ofCoordinates(
                    checkRange("lat", lat, 90),
                    checkRange("lng", lng, 180)
            );
        }
        return LocationQuery.ofName(name);
    }

    static LocalDate date(String raw, LocalDate fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new BadRequestException("Invalid date '" + raw + "', expected YYYY-MM-DD");
        }
    }

    static int hour(String startTime) {
        if (startTime == null || startTime.isBlank()) {
            return DEFAULT_START_HOUR;
        }
        OptionalInt hour = HourFormat.parseHour(startTime);
        if (hour.isEmpty()) {
            throw new BadRequestException("Invalid startTime '" + startTime + "'");
        }
        return hour.getAsInt();
    }

    static String timeSlotLabel(String startTime, String endTime, TimeSlot slot) {
        boolean hasStart = startTime != null && !startTime.isBlank();
        boolean hasEnd = endTime != null && !endTime.isBlank();
        if (hasStart && hasEnd) {
            return startTime.trim() + " - " + endTime.trim();
        }
        return slot.label();
    }

    static Set<ServiceId> services(String raw) {
        if (raw == null || raw.isBlank() || "all".equalsIgnoreCase(raw.trim())) {
            return EnumSet.allOf(ServiceId.class);
        }
        Set<ServiceId> services = EnumSet.noneOf(ServiceId.class);
        for (String part : raw.split(",")) {
            if (part.isBlank()) {
                continue;
            }
            services.add(ServiceId.lookup(part.trim())
                    .orElseThrow(() -> new BadRequestException("Unknown service '" + part.trim() + "'")));
        }
        if (services.isEmpty()) {
            throw new BadRequestException("No services requested");
        }
        return services;
    }

    private static double coordinate(String name, String raw, double limit) {
        try {
            return checkRange(name, Double.parseDouble(raw.trim()), limit);
        } catch (NumberFormatException e) {
            throw new BadRequestException("Invalid " + name + " '" + raw + "'");
        }
    }

    private static double checkRange(String name, double value, double limit) {
        if (!Double.isFinite(value) || value < -limit || value > limit) {
            throw new BadRequestException(name + " out of range: " + value);
        }
        return value;
    }
}
