package com.tradingrisk.rules;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Position sizing parameters from the {@code lot_calculation} section.
 *
 * <p>Pip values are keyed by upper-cased instrument symbol. Unknown instruments fall back
 * to {@link #DEFAULT_PIP_VALUE}.
 */
@Getter
@Builder
public class LotSizingRules {

    public static final BigDecimal DEFAULT_PIP_VALUE = BigDecimal.TEN;
    public static final BigDecimal DEFAULT_MIN_LOT = new BigDecimal("0.01");
    public static final BigDecimal DEFAULT_MAX_LOT = new BigDecimal("10.0");

    private final Map<String, BigDecimal> pipValues;
    private final BigDecimal minLotSize;
    private final BigDecimal maxLotSize;

    /**
     * Returns the pip value for an instrument, matched case-insensitively.
     */
    public BigDecimal pipValue(String instrument) {
        if (instrument == null) {
            return DEFAULT_PIP_VALUE;
        }
        return pipValues.getOrDefault(instrument.trim().toUpperCase(Locale.ROOT), DEFAULT_PIP_VALUE);
    }
}
