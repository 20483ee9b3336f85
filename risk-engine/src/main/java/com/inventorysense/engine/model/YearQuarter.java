package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Comparator;
import java.util.Locale;

/**
 * A (year, quarter) period such as "2022 Q2".
 */
public record YearQuarter(int year, Quarter quarter) implements Comparable<YearQuarter> {

    private static final Comparator<YearQuarter> ORDER =
        Comparator.comparingInt(YearQuarter::year).thenComparing(YearQuarter::quarter);

    /**
     * Parse a quarter label. Accepts "2022 Q2" and the dashboard form "2022 2022Q2".
     *
     * @throws IllegalArgumentException if the label is malformed
     */
    public static YearQuarter parse(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Quarter label is required");
        }
        String[] parts = label.trim().split("\\s+");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid quarter label: '" + label + "'. Expected format: 2022 Q2");
        }
        try {
            int year = Integer.parseInt(parts[0]);
            String quarterPart = parts[1].startsWith(parts[0])
                ? parts[1].substring(parts[0].length())
                : parts[1];
            return new YearQuarter(year, Quarter.valueOf(quarterPart.toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid quarter label: '" + label + "'. Expected format: 2022 Q2", e);
        }
    }

    @JsonValue
    public String label() {
        return year + " " + quarter;
    }

    @Override
    public int compareTo(YearQuarter other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return label();
    }
}
