package com.gigpulse.core.forecast;

import com.gigpulse.core.model.ServiceId;

public record ServiceForecast(ServiceId service, double netHourly, double jobsPerHour, double surgeOrPeakValue) {
}
