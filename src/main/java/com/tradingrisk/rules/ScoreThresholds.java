package com.tradingrisk.rules;

import lombok.Value;

/**
 * Score cutoffs for the risk tiers. Scores below {@code noTrade} forbid trading, scores at or
 * above {@code risk2Percent} unlock the elevated tier.
 */
@Value
public class ScoreThresholds {

    public static final double DEFAULT_NO_TRADE = 50;
    public static final double DEFAULT_RISK_2_PERCENT = 70;

    double noTrade;
    double risk2Percent;
}
