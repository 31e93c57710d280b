package com.gigpulse.service.api;

import java.util.List;

public record BatchRequest(
        String location,
        Double lat,
        Double lng,
        String date,
        String service,
        List<TimeSlotRequest> timeSlots
) {
    public record TimeSlotRequest(String startTime, String endTime) {
    }
}
