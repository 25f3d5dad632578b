package com.tradingrisk.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Everything one person supplied during one assessment: answers keyed by question id, running
 * stats and, optionally, trade details.
 *
 * <p>Each conversation or request builds its own session and passes it to the pipeline; sessions
 * are never shared, so concurrent assessments cannot see each other's answers.
 */
@Getter
public class AssessmentSession {

    private final Map<String, Object> answers;
    private final TradingStats stats;
    private final TradeDetails tradeDetails;

    @Builder
    private AssessmentSession(Map<String, Object> answers, TradingStats stats, TradeDetails tradeDetails) {
        this.answers = answers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(answers)) : Map.of();
        this.stats = stats != null ? stats : TradingStats.empty();
        this.tradeDetails = tradeDetails;
    }

    /** Returns a copy of this session carrying the given trade details, for re-evaluation. */
    public AssessmentSession withTradeDetails(TradeDetails details) {
        return new AssessmentSession(answers, stats, details);
    }
}
