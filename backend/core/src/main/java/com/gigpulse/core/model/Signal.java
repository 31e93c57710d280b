package com.gigpulse.core.model;

public interface Signal {
    String DEFAULT_ORIGIN = "default";

    SignalSource source();

    String origin();

    boolean degraded();
}
