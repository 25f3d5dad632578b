package com.tradingrisk.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Running trading statistics supplied with each evaluation. Not owned by the engine.
 *
 * <p>Fields the caller leaves unset stay at 0, the most permissive value for the hard-stop checks.
 */
@Value
@Builder
public class TradingStats {

    int consecutiveLosses;
    double dailyLossPercent;

    public static TradingStats empty() {
        return TradingStats.builder().build();
    }
}
