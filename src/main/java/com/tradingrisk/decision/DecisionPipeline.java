package com.tradingrisk.decision;

import com.tradingrisk.domain.model.AssessmentSession;
import com.tradingrisk.domain.model.TradeDetails;
import com.tradingrisk.domain.model.TradingStats;
import com.tradingrisk.risk.HardStopGate;
import com.tradingrisk.risk.HardStopOutcome;
import com.tradingrisk.risk.RiskDecider;
import com.tradingrisk.risk.RiskTier;
import com.tradingrisk.scoring.ScoreBreakdown;
import com.tradingrisk.scoring.ScoreEngine;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point of the decision engine: runs the hard-stop gate, scoring and risk tiering for one
 * assessment and assembles a {@link RiskDecision}.
 *
 * <p>Steps (strictly in order):
 * <ol>
 *   <li>{@link HardStopGate}: on failure return a blocked decision; scoring never runs</li>
 *   <li>{@link ScoreEngine#scoreFinal}</li>
 *   <li>{@link RiskDecider#decide}</li>
 *   <li>{@link RiskDecider#lotSize} when trading is allowed and trade details are complete</li>
 * </ol>
 *
 * <p>Nothing is cached: re-evaluating the same answers with trade details added recomputes the
 * gate and the scores and yields the same results. The only input besides the arguments is the
 * immutable rule set (and the clock for the timestamp).
 */
@Service
public class DecisionPipeline {

    private static final Logger log = LoggerFactory.getLogger(DecisionPipeline.class);

    private final HardStopGate hardStopGate;
    private final ScoreEngine scoreEngine;
    private final RiskDecider riskDecider;
    private final Clock clock;

    public DecisionPipeline(HardStopGate hardStopGate, ScoreEngine scoreEngine, RiskDecider riskDecider, Clock clock) {
        this.hardStopGate = hardStopGate;
        this.scoreEngine = scoreEngine;
        this.riskDecider = riskDecider;
        this.clock = clock;
    }

    public RiskDecision evaluate(AssessmentSession session) {
        return evaluate(session.getAnswers(), session.getStats(), session.getTradeDetails());
    }

    public RiskDecision evaluate(Map<String, Object> answers, TradingStats stats) {
        return evaluate(answers, stats, null);
    }

    /**
     * Evaluates one assessment.
     *
     * @param answers raw answers keyed by question id
     * @param stats running stats
     * @param tradeDetails optional; lot size is computed only when complete
     * @return a new immutable decision
     */
    public RiskDecision evaluate(Map<String, Object> answers, TradingStats stats, TradeDetails tradeDetails) {
        Map<String, Object> safeAnswers = answers != null ? answers : Map.of();
        LocalDateTime now = LocalDateTime.now(clock);

        HardStopOutcome hardStopOutcome = hardStopGate.evaluate(safeAnswers, stats);
        if (hardStopOutcome.isFailed()) {
            log.info("Trading blocked by hard stops: {}", hardStopOutcome.getReason());
            return RiskDecision.blocked(hardStopOutcome, now);
        }

        ScoreBreakdown scoreBreakdown = scoreEngine.scoreFinal(safeAnswers);
        RiskTier riskTier = riskDecider.decide(scoreBreakdown.getFinalScore());

        BigDecimal lotSize = null;
        if (riskTier.isShouldTrade() && tradeDetails != null && tradeDetails.isComplete()) {
            lotSize = riskDecider.lotSize(riskTier.getRiskPercent(), tradeDetails);
        }

        log.info(
                "Decision: score={}, tier={}, risk={}%, lotSize={}",
                scoreBreakdown.getFinalScore(),
                riskTier,
                riskTier.getRiskPercent(),
                lotSize);

        return RiskDecision.builder()
                .shouldTrade(riskTier.isShouldTrade())
                .riskPercent(riskTier.getRiskPercent())
                .finalScore(scoreBreakdown.getFinalScore())
                .categoryScores(scoreBreakdown.getCategoryScores())
                .answers(scoreBreakdown.getAnswers())
                .hardStopOutcome(hardStopOutcome)
                .lotSize(lotSize)
                .timestamp(now)
                .build();
    }
}
