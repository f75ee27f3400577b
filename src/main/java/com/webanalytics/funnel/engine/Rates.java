package com.webanalytics.funnel.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Percentage arithmetic shared by the aggregators. Every rate is rounded half-up to
 * 2 decimals and a zero denominator yields 0.
 */
final class Rates {

    private Rates() {}

    static double percentage(long part, long whole) {
        if (whole <= 0) {
            return 0;
        }
        return BigDecimal.valueOf(part)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(whole), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
