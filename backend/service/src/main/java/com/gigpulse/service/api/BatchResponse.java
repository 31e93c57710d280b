package com.gigpulse.service.api;

import java.time.LocalDate;
import java.util.List;

public record BatchResponse(String location, LocalDate date, List<EarningsResponse> results) {
}
