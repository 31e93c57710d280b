package com.gigpulse.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SignalSource {
    EVENTS("events"),
    WEATHER("weather"),
    TRAFFIC("traffic"),
    FUEL("fuel"),
    PRICING("pricing");

    private final String wireName;

    SignalSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
