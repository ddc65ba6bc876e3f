package com.coursecatalog.scraper;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Course points: a fixed value (min == max) or a range.
 */
public record Credits(double min, double max) {
    public Credits {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("Invalid credits range " + min + "-" + max);
        }
    }

    public static Credits fixed(double value) {
        return new Credits(value, value);
    }

    @JsonIgnore
    public boolean isFixed() {
        return min == max;
    }

    @JsonIgnore
    public boolean isZero() {
        return min == 0 && max == 0;
    }

    @Override
    public String toString() {
        return isFixed() ? format(min) : format(min) + "-" + format(max);
    }

    private static String format(double v) {
        return v == Math.rint(v) ? Long.toString((long) v) : Double.toString(v);
    }
}
