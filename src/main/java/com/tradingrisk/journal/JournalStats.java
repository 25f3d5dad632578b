package com.tradingrisk.journal;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregate figures over the journal entries of a recent period.
 */
@Value
@Builder
public class JournalStats {

    int days;
    int totalSessions;
    int tradesTaken;

    /** Mean final score, 1 decimal. */
    double avgScore;

    /** Share of sessions with a trade recommendation, in percent, 1 decimal. */
    double tradeRate;

    int risk2PercentCount;
    int risk3PercentCount;
}
