package com.inventorysense.engine.aggregate;

import com.inventorysense.engine.model.RiskStatus;
import com.inventorysense.engine.util.Numbers;

/**
 * Risk rules for a distributor-quarter.
 *
 * <p><b>Limit tier</b> (used whenever {@code pctFromLimit} is present):
 * HIGH RISK ({@literal >=}120), RISK ({@literal >=}100), VERY GOOD ({@literal <}80), GOOD (rest).
 *
 * <p><b>Trend tier</b> (only without a limit signal): HIGH RISK ({@literal >}10),
 * RISK ({@literal >}0), VERY GOOD ({@literal <}-10), GOOD (rest).
 *
 * <p>With neither signal the row is NOT CLASSIFIED.
 */
public final class RiskClassifier {

    private RiskClassifier() {
    }

    /**
     * Percent by which waste exceeds its allowance, rounded to 2 decimals.
     * Zero waste or zero allowance yields 0 rather than a division.
     */
    public static double pctFromLimit(double waste, double allowance) {
        if (allowance == 0 || waste == 0) {
            return 0.0;
        }
        return Numbers.round((waste - allowance) / allowance * 100, 2);
    }

    public static RiskStatus classify(Double pctFromLimit, Double pctChange) {
        if (pctFromLimit != null) {
            if (pctFromLimit >= 120) {
                return RiskStatus.HIGH_RISK;
            }
            if (pctFromLimit >= 100) {
                return RiskStatus.RISK;
            }
            if (pctFromLimit < 80) {
                return RiskStatus.VERY_GOOD;
            }
            return RiskStatus.GOOD;
        }

        if (pctChange != null) {
            if (pctChange > 10) {
                return RiskStatus.HIGH_RISK;
            }
            if (pctChange > 0) {
                return RiskStatus.RISK;
            }
            if (pctChange < -10) {
                return RiskStatus.VERY_GOOD;
            }
            return RiskStatus.GOOD;
        }

        return RiskStatus.NOT_CLASSIFIED;
    }
}
