package com.bank.fraud.context;

import java.util.Collection;
import java.util.OptionalDouble;

/**
 * Statistics shared by the signal groups. Every function answers "empty" rather
 * than dividing by zero.
 */
public final class SignalMath {

    private static final double EARTH_RADIUS_KM = 6371.0;

    private SignalMath() {}

    public static OptionalDouble mean(Collection<Double> values) {
        if (values.isEmpty()) return OptionalDouble.empty();
        double sum = 0.0;
        for (double v : values) sum += v;
        return OptionalDouble.of(sum / values.size());
    }

    /**
     * Population standard deviation (divides by n, not n - 1).
     */
    public static OptionalDouble populationStdDev(Collection<Double> values) {
        OptionalDouble mean = mean(values);
        if (mean.isEmpty()) return OptionalDouble.empty();
        double m = mean.getAsDouble();
        double sq = 0.0;
        for (double v : values) sq += (v - m) * (v - m);
        return OptionalDouble.of(Math.sqrt(sq / values.size()));
    }

    /**
     * Coefficient of variation (stddev / mean). Empty for an empty sample or a zero mean.
     */
    public static OptionalDouble coefficientOfVariation(Collection<Double> values) {
        OptionalDouble mean = mean(values);
        if (mean.isEmpty() || mean.getAsDouble() == 0.0) return OptionalDouble.empty();
        return OptionalDouble.of(populationStdDev(values).getAsDouble() / Math.abs(mean.getAsDouble()));
    }

    /**
     * |value - mean| / stddev. Empty when the stddev is zero.
     */
    public static OptionalDouble zScore(double value, double mean, double stdDev) {
        if (stdDev <= 0.0) return OptionalDouble.empty();
        return OptionalDouble.of(Math.abs(value - mean) / stdDev);
    }

    /**
     * Great-circle distance in kilometres between two WGS84 coordinates.
     */
    public static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    public static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
