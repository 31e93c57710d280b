package com.gigpulse.core.forecast;

import com.gigpulse.core.model.Category;
import com.gigpulse.core.model.ServiceProfile;
import com.gigpulse.core.model.SignalSource;

import java.util.Set;

public interface CategoryStrategy {
    Category category();

    Set<SignalSource> contributingSources();

    MarketConditions market(ForecastInput input);

    ServiceForecast forecast(ServiceProfile profile, ForecastInput input, MarketConditions market);
}
