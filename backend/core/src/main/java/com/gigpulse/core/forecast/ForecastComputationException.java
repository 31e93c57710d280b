package com.gigpulse.core.forecast;

public class ForecastComputationException extends RuntimeException {
    public ForecastComputationException(String message) {
        super(message);
    }

    static double requireFinite(String quantity, double value) {
        if (!Double.isFinite(value)) {
            throw new ForecastComputationException(quantity + " is not finite: " + value);
        }
        return value;
    }
}
