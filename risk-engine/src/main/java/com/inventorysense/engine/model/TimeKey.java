package com.inventorysense.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Month;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Year, month and quarter derived from a {@code Mon-YY} month label.
 */
public record TimeKey(
    @JsonProperty("year") int year,
    @JsonProperty("month") int month,
    @JsonProperty("quarter") Quarter quarter
) {
    public TimeKey {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Month out of range: " + month);
        }
    }

    public static TimeKey of(int year, int month) {
        return new TimeKey(year, month, Quarter.fromMonth(month));
    }

    /**
     * Abbreviated English month name, e.g. "Feb".
     */
    public String monthName() {
        return Month.of(month).getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
    }
}
