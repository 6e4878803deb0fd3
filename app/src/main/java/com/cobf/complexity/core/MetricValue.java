package com.cobf.complexity.core;

/**
 * One displayed metric: a formatted value and, for comparable numbers, the
 * formatted change from the original program. Ratings and other labels carry
 * no delta.
 */
public record MetricValue(String value, String delta) {

    public static final String NOT_AVAILABLE = "N/A";

    public static MetricValue bare(String value) {
        return new MetricValue(value, null);
    }

    public static MetricValue of(String value, String delta) {
        return new MetricValue(value, delta);
    }

    public static MetricValue unavailable() {
        return new MetricValue(NOT_AVAILABLE, NOT_AVAILABLE);
    }

    public boolean hasDelta() {
        return delta != null;
    }

    public boolean isAvailable() {
        return !NOT_AVAILABLE.equals(value);
    }

    @Override
    public String toString() {
        return hasDelta() ? value + " (" + delta + ")" : value;
    }
}
