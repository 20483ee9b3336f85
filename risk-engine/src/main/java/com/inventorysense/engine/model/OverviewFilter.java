package com.inventorysense.engine.model;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Year and month-name filters of the overview dashboard. Empty sets disable a filter.
 */
public record OverviewFilter(Set<Integer> years, Set<String> months) {

    public static final String ALL_YEARS = "All Years";
    public static final String ALL_MONTHS = "All Months";

    public static OverviewFilter none() {
        return new OverviewFilter(Set.of(), Set.of());
    }

    /**
     * Build from multi-select request values; a sentinel anywhere in a list disables that filter.
     *
     * @throws IllegalArgumentException for a non-numeric year
     */
    public static OverviewFilter of(List<String> years, List<String> months) {
        Set<Integer> yearSet = Set.of();
        if (years != null && !years.isEmpty() && !years.contains(ALL_YEARS)) {
            try {
                yearSet = years.stream().map(String::trim).map(Integer::valueOf).collect(Collectors.toUnmodifiableSet());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Year filter must be numeric: " + years, e);
            }
        }
        Set<String> monthSet = Set.of();
        if (months != null && !months.isEmpty() && !months.contains(ALL_MONTHS)) {
            monthSet = Set.copyOf(months);
        }
        return new OverviewFilter(yearSet, monthSet);
    }

    public boolean filtersTime() {
        return !years.isEmpty() || !months.isEmpty();
    }

    public boolean matchesYear(int year) {
        return years.isEmpty() || years.contains(year);
    }

    public boolean matches(TimeKey key) {
        if (!filtersTime()) {
            return true;
        }
        if (key == null) {
            return false;
        }
        return matchesYear(key.year()) && (months.isEmpty() || months.contains(key.monthName()));
    }
}
