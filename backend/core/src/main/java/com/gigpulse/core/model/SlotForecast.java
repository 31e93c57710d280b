package com.gigpulse.core.model;

import java.util.List;
import java.util.Set;

public record SlotForecast(
        LocationKey locationKey,
        String locationLabel,
        TimeSlot slot,
        List<EarningsEstimate> estimates,
        List<SignalSource> dataSources,
        List<SignalSource> degradedSources,
        boolean locationFallback
) {
    public SlotForecast {
        estimates = List.copyOf(estimates);
        dataSources = List.copyOf(dataSources);
        degradedSources = List.copyOf(degradedSources);
    }

    public boolean usingLiveData() {
        return !dataSources.isEmpty();
    }

    public SlotForecast forServices(Set<ServiceId> services) {
        List<EarningsEstimate> filtered = estimates.stream()
                .filter(estimate -> services.contains(estimate.service()))
                .toList();
        return new SlotForecast(locationKey, locationLabel, slot, filtered, dataSources, degradedSources, locationFallback);
    }
}
