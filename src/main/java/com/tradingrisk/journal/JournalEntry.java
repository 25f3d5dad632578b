package com.tradingrisk.journal;

import com.tradingrisk.domain.model.TradeDetails;
import com.tradingrisk.domain.model.TradingStats;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * One saved assessment session: what was answered, what the engine decided, and the trader's notes.
 */
@Value
@Builder
public class JournalEntry {

    String id;
    LocalDateTime timestamp;
    Map<String, Object> answers;
    TradingStats stats;
    boolean shouldTrade;
    double riskPercent;
    double finalScore;
    Map<String, Double> categoryScores;
    boolean hardStopsPassed;
    TradeDetails tradeDetails;

    /** Null when no trade was recommended or no trade details were given. */
    BigDecimal lotSize;

    String notes;
}
