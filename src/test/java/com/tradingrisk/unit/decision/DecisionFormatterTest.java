package com.tradingrisk.unit.decision;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradingrisk.decision.DecisionFormatter;
import com.tradingrisk.decision.DecisionPipeline;
import com.tradingrisk.decision.RiskDecision;
import com.tradingrisk.domain.model.TradeDetails;
import com.tradingrisk.domain.model.TradingStats;
import com.tradingrisk.risk.HardStopGate;
import com.tradingrisk.risk.RiskDecider;
import com.tradingrisk.rules.RuleConfig;
import com.tradingrisk.scoring.AnswerNormalizerRegistry;
import com.tradingrisk.scoring.ScoreEngine;
import com.tradingrisk.unit.RuleConfigFixtures;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for DecisionFormatter text output.
 */
class DecisionFormatterTest {

    private DecisionPipeline pipeline;
    private DecisionFormatter formatter;

    @BeforeEach
    void setUp() {
        RuleConfig ruleConfig = RuleConfigFixtures.standard();
        pipeline = new DecisionPipeline(
                new HardStopGate(ruleConfig),
                new ScoreEngine(ruleConfig, AnswerNormalizerRegistry.defaults()),
                new RiskDecider(ruleConfig),
                Clock.systemUTC());
        formatter = new DecisionFormatter();
    }

    @Test
    @DisplayName("Tradeable decision shows score, risk and lot size")
    void tradeable() {
        RiskDecision decision = pipeline.evaluate(
                RuleConfigFixtures.passingAnswers(),
                TradingStats.empty(),
                TradeDetails.builder()
                        .balance(new BigDecimal("10000"))
                        .stopLossPips(new BigDecimal("20"))
                        .instrument("EURUSD")
                        .build());

        String text = formatter.formatDecision(decision);

        assertThat(text)
                .contains("TRADING DECISION")
                .contains("Final score: 81.5/100")
                .contains("  - Market Conditions: 75.0/100")
                .contains("You may trade with 3% risk")
                .contains("Recommended lot size: 1.50 lots")
                .doesNotContain("DO NOT TRADE");
    }

    @Test
    @DisplayName("Blocked decision shows the hard-stop reason only")
    void blocked() {
        RiskDecision decision = pipeline.evaluate(
                RuleConfigFixtures.passingAnswers(), TradingStats.builder().dailyLossPercent(7).build());

        String text = formatter.formatDecision(decision);

        assertThat(text)
                .contains("NO TRADING TODAY")
                .contains("Reason: Hard stops failed: Daily loss (7%) >= 5%")
                .doesNotContain("Final score");
    }

    @Test
    @DisplayName("Low score tells the trader not to trade")
    void lowScore() {
        Map<String, Object> answers = new HashMap<>(RuleConfigFixtures.passingAnswers());
        answers.put("mental_state", 3);
        answers.put("trend_alignment", false);
        answers.put("volatility", 1);

        String text = formatter.formatDecision(pipeline.evaluate(answers, TradingStats.empty()));

        assertThat(text).contains("DO NOT TRADE TODAY").doesNotContain("You may trade");
    }

    @Test
    @DisplayName("Breakdown groups answers by category with quality flags")
    void breakdown() {
        Map<String, Object> answers = new HashMap<>(RuleConfigFixtures.passingAnswers());
        answers.put("sleep_quality", 5.5);

        String text = formatter.formatBreakdown(pipeline.evaluate(answers, TradingStats.empty()));

        assertThat(text)
                .contains("DETAILED BREAKDOWN")
                .contains("Psychology")
                .contains("Technical Confluence")
                .contains("Answer: 5.5 | Score: 50.0/100")
                .contains("[CAUTION]")
                .contains("[GOOD]");
    }
}
