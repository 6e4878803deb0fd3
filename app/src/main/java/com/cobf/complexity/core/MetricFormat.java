package com.cobf.complexity.core;

import java.util.Locale;
import java.util.OptionalDouble;

import static com.cobf.complexity.core.MetricValue.NOT_AVAILABLE;

/**
 * Display formatting shared by all metric units.
 * Any "N/A" operand makes the formatted result "N/A".
 */
public final class MetricFormat {

    private static final String[] SI_SUFFIXES = { "", "K", "M", "G", "T", "P", "E", "Z", "Y" };
    private static final String[] BINARY_SUFFIXES = { "", "Ki", "Mi", "Gi", "Ti", "Pi", "Ei", "Zi", "Yi" };

    private MetricFormat() {
    }

    /** Signed integer change, truncating the difference toward zero. */
    public static String intDelta(double newValue, double oldValue) {
        long delta = (long) (newValue - oldValue);
        return delta >= 0 ? "+" + delta : Long.toString(delta);
    }

    public static String intDelta(OptionalDouble newValue, OptionalDouble oldValue) {
        if (newValue.isEmpty() || oldValue.isEmpty()) {
            return NOT_AVAILABLE;
        }
        return intDelta(newValue.getAsDouble(), oldValue.getAsDouble());
    }

    /** Signed change to one decimal place. */
    public static String floatDelta(double newValue, double oldValue) {
        double delta = newValue - oldValue;
        String text = decimal(delta);
        return delta >= 0.0 ? "+" + text : text;
    }

    public static String floatDelta(OptionalDouble newValue, OptionalDouble oldValue) {
        if (newValue.isEmpty() || oldValue.isEmpty()) {
            return NOT_AVAILABLE;
        }
        return floatDelta(newValue.getAsDouble(), oldValue.getAsDouble());
    }

    /** Integer value, truncated toward zero. */
    public static String integer(OptionalDouble value) {
        return value.isPresent() ? Long.toString((long) value.getAsDouble()) : NOT_AVAILABLE;
    }

    public static String decimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    public static String decimal(OptionalDouble value) {
        return value.isPresent() ? decimal(value.getAsDouble()) : NOT_AVAILABLE;
    }

    /**
     * Human readable byte size such as {@code 4.5KB} or {@code 2.0KiB}.
     *
     * @param bytes        size, may be negative for a change in size
     * @param binarySuffix use powers of 1024 and Ki/Mi/... instead of powers of 1000
     * @param signed       prefix non-negative sizes with "+"
     */
    public static String fileSize(long bytes, boolean binarySuffix, boolean signed) {
        String[] suffixes = binarySuffix ? BINARY_SUFFIXES : SI_SUFFIXES;
        double step = binarySuffix ? 1024.0 : 1000.0;
        double size = Math.abs((double) bytes);
        int unit = 0;
        while (size >= step && unit < suffixes.length - 1) {
            size /= step;
            unit++;
        }
        String text = decimal(size) + suffixes[unit] + "B";
        if (bytes < 0) {
            return "-" + text;
        }
        return signed ? "+" + text : text;
    }

    /**
     * Duration from the largest non-zero unit down to seconds, e.g. {@code 9m 3s}.
     */
    public static String duration(long seconds) {
        StringBuilder text = new StringBuilder(seconds % 60 + "s");
        long rest = seconds / 60;
        if (rest == 0) {
            return text.toString();
        }
        text.insert(0, rest % 60 + "m ");
        rest /= 60;
        if (rest == 0) {
            return text.toString();
        }
        text.insert(0, rest % 24 + "h ");
        rest /= 24;
        if (rest == 0) {
            return text.toString();
        }
        return text.insert(0, rest + "d ").toString();
    }

    public static String duration(OptionalDouble seconds) {
        return seconds.isPresent() ? duration((long) seconds.getAsDouble()) : NOT_AVAILABLE;
    }
}
