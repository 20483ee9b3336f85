package com.inventorysense.engine.model;

/**
 * Calendar quarter derived from a 1-based month by integer division.
 */
public enum Quarter {
    Q1, Q2, Q3, Q4;

    /**
     * Month 1-3 maps to Q1, 4-6 to Q2, 7-9 to Q3 and 10-12 to Q4.
     */
    public static Quarter fromMonth(int month) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Month out of range: " + month);
        }
        return values()[(month - 1) / 3];
    }
}
