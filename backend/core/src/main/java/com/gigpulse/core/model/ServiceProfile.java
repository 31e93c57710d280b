package com.gigpulse.core.model;

import java.util.Objects;

public record ServiceProfile(
        ServiceId service,
        double averageDistanceMiles,
        double averageDurationMinutes,
        double perMile,
        double perMinute,
        double averageTip,
        RideFare rideFare,
        DeliveryPay deliveryPay
) {
    public ServiceProfile {
        Objects.requireNonNull(service, "service is required");
        if (averageDistanceMiles <= 0 || averageDurationMinutes <= 0) {
            throw new IllegalArgumentException("Average job size must be positive for " + service);
        }
        if (service.category() == Category.RIDESHARE && rideFare == null) {
            throw new IllegalArgumentException("Rideshare profile " + service + " needs rideFare");
        }
        if (service.category() == Category.DELIVERY && deliveryPay == null) {
            throw new IllegalArgumentException("Delivery profile " + service + " needs deliveryPay");
        }
    }

    public Category category() {
        return service.category();
    }

    public record RideFare(double baseFare, double bookingFee, double minimumFare) {
    }

    public record DeliveryPay(
            double basePayMin,
            double basePayMax,
            double tierStartMiles,
            double tierEndMiles,
            double fixedFees,
            double peakPayMax,
            double guaranteedMinimum
    ) {
        public DeliveryPay {
            if (basePayMax < basePayMin || tierEndMiles < tierStartMiles) {
                throw new IllegalArgumentException("Delivery pay tiers must be ascending");
            }
        }
    }
}
