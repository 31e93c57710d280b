package com.gigpulse.core.model;

public enum Category {
    RIDESHARE,
    DELIVERY
}
