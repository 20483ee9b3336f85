package com.inventorysense.engine.model;

import java.util.Locale;

/**
 * Equality filters applied to the deduplicated alert list. A {@code null} field matches everything.
 * Severity is compared by upper-cased name, so an unknown severity matches no alert.
 */
public record AlertFilter(String severity, Integer distributorId, String state) {

    public static final String ALL = "ALL";

    public static AlertFilter none() {
        return new AlertFilter(null, null, null);
    }

    /**
     * Build a filter from request parameters where {@value #ALL} (or a blank value) disables a filter.
     *
     * @throws IllegalArgumentException for a non-numeric distributor
     */
    public static AlertFilter of(String severity, String distributor, String state) {
        String parsedSeverity = isActive(severity) ? severity.trim().toUpperCase(Locale.ROOT) : null;
        Integer parsedDistributor = null;
        if (isActive(distributor)) {
            try {
                parsedDistributor = Integer.parseInt(distributor.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Distributor must be numeric or ALL: " + distributor, e);
            }
        }
        return new AlertFilter(parsedSeverity, parsedDistributor, isActive(state) ? state : null);
    }

    private static boolean isActive(String value) {
        return value != null && !value.isBlank() && !ALL.equalsIgnoreCase(value.trim());
    }

    public boolean matches(Alert alert) {
        return (severity == null || severity.equals(alert.severity().name()))
            && (distributorId == null || distributorId == alert.distributorId())
            && (state == null || state.equals(alert.state()));
    }
}
