package com.gigpulse.service.api;

import com.gigpulse.core.model.EarningsEstimate;
import com.gigpulse.core.model.ServiceId;
import com.gigpulse.core.model.SignalSource;
import com.gigpulse.core.model.SlotForecast;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

public record EarningsResponse(
        String location,
        LocalDate date,
        String timeSlot,
        int hour,
        List<Prediction> predictions,
        Metadata metadata
) {
    public record Prediction(
            String service,
            double min,
            double max,
            String hotspot,
            double demandScore,
            double jobsPerHour,
            double surgeOrPeakValue,
            String color
    ) {
        static Prediction from(EarningsEstimate estimate) {
            return new Prediction(
                    estimate.service().displayName(),
                    estimate.min(),
                    estimate.max(),
                    estimate.hotspot(),
                    estimate.demandScore(),
                    estimate.jobsPerHour(),
                    estimate.surgeOrPeakValue(),
                    estimate.color()
            );
        }
    }

    public record Metadata(
            boolean usingLiveData,
            List<SignalSource> dataSources,
            List<SignalSource> degradedSources,
            boolean locationFallback,
            Boolean lightweight
    ) {
    }

    static EarningsResponse from(SlotForecast forecast, String timeSlot, Set<ServiceId> services, boolean lightweight) {
        return new EarningsResponse(
                forecast.locationLabel(),
                forecast.slot().date(),
                timeSlot,
                forecast.slot().hour(),
                predictions(forecast, services),
                new Metadata(
                        forecast.usingLiveData(),
                        forecast.dataSources(),
                        forecast.degradedSources(),
                        forecast.locationFallback(),
                        lightweight ? Boolean.TRUE : null
                )
        );
    }

    static List<Prediction> predictions(SlotForecast forecast, Set<ServiceId> services) {
        return forecast.forServices(services).estimates().stream()
                .map(Prediction::from)
                .toList();
    }
}
