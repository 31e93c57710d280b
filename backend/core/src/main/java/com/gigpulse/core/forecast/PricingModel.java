package com.gigpulse.core.forecast;

import com.gigpulse.core.model.ServiceProfile;
import com.gigpulse.core.model.ServiceProfile.DeliveryPay;
import com.gigpulse.core.model.ServiceProfile.RideFare;

import java.util.Map;

public final class PricingModel {
    private static final Map<Integer, Double> PEAK_PAY_SHARE = Map.of(
            11, 0.3,
            12, 0.6,
            13, 0.6,
            14, 0.3,
            17, 0.3,
            18, 1.0,
            19, 1.0,
            20, 0.3
    );

    private final ForecastTuning tuning;

    public PricingModel(ForecastTuning tuning) {
        this.tuning = tuning;
    }

    public double surge(double ratio, double eventBoost) {
        double surge = 1.0;
        if (ratio > 2.0) {
            surge = 1.0 + (ratio - 2.0) * 0.1;
        } else if (ratio > 1.5) {
            surge = 1.0 + (ratio - 1.5) * 0.05;
        }
        surge += Math.min(eventBoost * 0.3, 0.15);
        return Math.min(surge, tuning.surgeCeiling());
    }

    public double tripFare(ServiceProfile profile, double durationMinutes, double rateMultiplier) {
        RideFare fare = profile.rideFare();
        double metered = fare.baseFare()
                + profile.averageDistanceMiles() * profile.perMile()
                + durationMinutes * profile.perMinute();
        return Math.max(fare.minimumFare(), metered * rateMultiplier + fare.bookingFee());
    }

    public double tieredBasePay(DeliveryPay pay, double distanceMiles) {
        if (distanceMiles <= pay.tierStartMiles()) {
            return pay.basePayMin();
        }
        if (distanceMiles >= pay.tierEndMiles()) {
            return pay.basePayMax();
        }
        double progress = (distanceMiles - pay.tierStartMiles()) / (pay.tierEndMiles() - pay.tierStartMiles());
        return pay.basePayMin() + progress * (pay.basePayMax() - pay.basePayMin());
    }

    public double peakPay(ServiceProfile profile, int hour, double eventBoost) {
        double peakPayMax = profile.deliveryPay().peakPayMax();
        double share = PEAK_PAY_SHARE.getOrDefault(hour, 0.0);
        return peakPayMax * share + peakPayMax * Math.min(eventBoost * 0.25, 0.12);
    }

    public double orderPay(ServiceProfile profile, double peakPay, double tipMultiplier) {
        DeliveryPay pay = profile.deliveryPay();
        double guaranteedPart = tieredBasePay(pay, profile.averageDistanceMiles())
                + pay.fixedFees()
                + profile.averageDurationMinutes() * profile.perMinute();
        return Math.max(pay.guaranteedMinimum(), guaranteedPart)
                + profile.averageDistanceMiles() * profile.perMile()
                + peakPay
                + profile.averageTip() * tipMultiplier;
    }
}
