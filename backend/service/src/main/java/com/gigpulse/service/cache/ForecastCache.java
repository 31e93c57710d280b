package com.gigpulse.service.cache;

import com.gigpulse.core.model.LocationKey;
import com.gigpulse.core.model.SlotForecast;
import com.gigpulse.core.model.TimeSlot;
import com.gigpulse.core.util.HashingUtils;

import java.util.Optional;
import java.util.function.Supplier;

public interface ForecastCache {
    // compute runs at most once per absent key, however many callers race for it
    SlotForecast getOrCompute(String key, Supplier<SlotForecast> compute);

    Optional<SlotForecast> peek(String key);

    void clear();

    CacheStats stats();

    static String keyFor(LocationKey location, TimeSlot slot) {
        return HashingUtils.sha256(location.value() + "|" + slot.date() + "|" + slot.hour());
    }
}
