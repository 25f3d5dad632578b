package com.tradingrisk.decision;

import com.tradingrisk.risk.HardStopOutcome;
import com.tradingrisk.scoring.AnswerRecord;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable outcome of one evaluation.
 *
 * <p>When the hard-stop gate failed, every scoring field is zero or empty and
 * {@code shouldTrade} is false. {@code lotSize} is only set when trading is allowed and
 * complete trade details were supplied.
 */
@Getter
@Builder
@ToString
public class RiskDecision {

    private final boolean shouldTrade;
    private final double riskPercent;
    private final double finalScore;
    private final Map<String, Double> categoryScores;
    private final List<AnswerRecord> answers;
    private final HardStopOutcome hardStopOutcome;
    private final BigDecimal lotSize;
    private final LocalDateTime timestamp;

    /** Decision for a session blocked by the hard-stop gate. */
    public static RiskDecision blocked(HardStopOutcome hardStopOutcome, LocalDateTime timestamp) {
        return RiskDecision.builder()
                .shouldTrade(false)
                .riskPercent(0.0)
                .finalScore(0.0)
                .categoryScores(Map.of())
                .answers(List.of())
                .hardStopOutcome(hardStopOutcome)
                .timestamp(timestamp)
                .build();
    }
}
