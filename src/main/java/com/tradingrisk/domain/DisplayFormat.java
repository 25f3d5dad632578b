package com.tradingrisk.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Number formatting for trader-facing messages: no trailing zeros, no exponent.
 */
public final class DisplayFormat {

    private DisplayFormat() {}

    public static String number(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return String.valueOf(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /** One decimal place, half-up, as used for scores. */
    public static String oneDecimal(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).toPlainString();
    }
}
