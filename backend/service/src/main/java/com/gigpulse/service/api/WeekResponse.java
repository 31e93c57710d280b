package com.gigpulse.service.api;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record WeekResponse(
        String location,
        LocalDate startDate,
        Map<String, Map<String, List<EarningsResponse.Prediction>>> weekData
) {
}
