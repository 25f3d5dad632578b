package com.tradingrisk.risk;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Discrete risk recommendation selected by final score.
 */
@Getter
@RequiredArgsConstructor
public enum RiskTier {
    NO_TRADE(false, 0.0),
    STANDARD(true, 2.0),
    ELEVATED(true, 3.0);

    private final boolean shouldTrade;

    /** Percentage of account balance to risk on the trade. */
    private final double riskPercent;
}
