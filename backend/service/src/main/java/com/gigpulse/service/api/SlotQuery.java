package com.gigpulse.service.api;

import com.gigpulse.core.location.LocationQuery;
import com.gigpulse.core.model.ServiceId;
import com.gigpulse.core.model.TimeSlot;

import java.util.Set;

public record SlotQuery(
        LocationQuery location,
        TimeSlot slot,
        String timeSlotLabel,
        Set<ServiceId> services
) {
}
