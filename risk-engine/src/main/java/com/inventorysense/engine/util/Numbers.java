package com.inventorysense.engine.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Numeric coercion and rounding shared by the analytics engines.
 * Rounding works on the exact binary value with half-even ties, so 2.675 rounds to 2.67.
 */
public final class Numbers {

    private Numbers() {
    }

    /**
     * Round a finite value to the given number of decimals.
     */
    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Cannot round non-finite value: " + value);
        }
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }

    /**
     * Null-preserving variant of {@link #round(double, int)}.
     */
    public static Double round(Double value, int scale) {
        return value == null ? null : round(value.doubleValue(), scale);
    }

    /**
     * Format a value with a fixed number of decimals, e.g. 150.0 or 9.0.
     */
    public static String format(double value, int scale) {
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).toPlainString();
    }

    /**
     * Coerce a raw cell to a double. Anything that is not a finite number
     * (blank strings, garbage, NaN) becomes {@code null}.
     */
    public static Double toDouble(Object raw) {
        if (raw == null || raw instanceof Boolean) {
            return null;
        }
        double value;
        if (raw instanceof Number number) {
            value = number.doubleValue();
        } else {
            String text = raw.toString().trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                value = Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return Double.isFinite(value) ? value : null;
    }

    /**
     * Coerce a raw cell to an integer identifier. Fractional values are rejected.
     */
    public static Integer toInteger(Object raw) {
        Double value = toDouble(raw);
        if (value == null || value != Math.rint(value)
                || value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            return null;
        }
        return value.intValue();
    }

    /**
     * Add a nullable measure to a running sum, skipping missing values.
     */
    public static double addSkippingMissing(double sum, Double value) {
        return value == null ? sum : sum + value;
    }
}
