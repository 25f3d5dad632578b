package com.tradingrisk.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradingrisk.domain.model.TradingStats;
import com.tradingrisk.risk.HardStopGate;
import com.tradingrisk.risk.HardStopOutcome;
import com.tradingrisk.risk.HardStopRule;
import com.tradingrisk.risk.HardStopViolation;
import com.tradingrisk.unit.RuleConfigFixtures;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for HardStopGate covering each check at its boundary, reporting of every failed
 * check, permissive defaults and the configurable check subset.
 */
class HardStopGateTest {

    private static final String HARD_STOPS = """
            hard_stops:
              max_consecutive_losses: 3
              max_daily_loss_percent: 5
              min_sleep_hours: 5
              psychology_min_score: 3
            """;

    private HardStopGate hardStopGate;
    private Map<String, Object> answers;

    @BeforeEach
    void setUp() {
        hardStopGate = new HardStopGate(RuleConfigFixtures.standard());
        answers = new HashMap<>(RuleConfigFixtures.passingAnswers());
    }

    private static TradingStats stats(int losses, double dailyLoss) {
        return TradingStats.builder().consecutiveLosses(losses).dailyLossPercent(dailyLoss).build();
    }

    // ==============================
    // INDIVIDUAL CHECKS
    // ==============================

    @Nested
    @DisplayName("Individual checks")
    class IndividualChecks {

        @Test
        @DisplayName("Passing answers and stats below limits pass the gate")
        void allWithinLimits_passes() {
            HardStopOutcome outcome = hardStopGate.evaluate(answers, stats(2, 4.9));

            assertThat(outcome.isPassed()).isTrue();
            assertThat(outcome.getViolations()).isEmpty();
            assertThat(outcome.getReason()).isNull();
        }

        @Test
        @DisplayName("Consecutive losses at the limit fail")
        void consecutiveLossesAtLimit_fails() {
            HardStopOutcome outcome = hardStopGate.evaluate(answers, stats(3, 0));

            assertThat(outcome.isFailed()).isTrue();
            assertThat(outcome.getFailedChecks()).containsExactly("Consecutive losses (3) >= 3");
        }

        @Test
        @DisplayName("Daily loss at the limit fails")
        void dailyLossAtLimit_fails() {
            HardStopOutcome outcome = hardStopGate.evaluate(answers, stats(0, 5.0));

            assertThat(outcome.getFailedChecks()).containsExactly("Daily loss (5%) >= 5%");
        }

        @Test
        @DisplayName("Sleep below the minimum fails, at the minimum passes")
        void sleepBoundary() {
            answers.put("sleep_quality", 4.5);
            assertThat(hardStopGate.evaluate(answers, stats(0, 0)).getFailedChecks())
                    .containsExactly("Hours of sleep (4.5) < 5");

            answers.put("sleep_quality", 5);
            assertThat(hardStopGate.evaluate(answers, stats(0, 0)).isPassed()).isTrue();
        }

        @Test
        @DisplayName("Mental state below the minimum fails")
        void mentalStateBelowMinimum_fails() {
            answers.put("mental_state", 2);

            HardStopOutcome outcome = hardStopGate.evaluate(answers, stats(0, 0));

            assertThat(outcome.getViolations())
                    .extracting(HardStopViolation::getCode)
                    .containsExactly("MENTAL_STATE");
        }

        @Test
        @DisplayName("Non-finite sleep and mental state read as 0 and fail")
        void nonFiniteAnswers_fail() {
            answers.put("sleep_quality", Double.NaN);
            answers.put("mental_state", "NaN");

            HardStopOutcome outcome = hardStopGate.evaluate(answers, stats(0, 0));

            assertThat(outcome.getFailedChecks())
                    .containsExactly("Hours of sleep (0) < 5", "Mental state (0) < 3");
        }

        @Test
        @DisplayName("NaN clear bias does not satisfy the clear bias check")
        void nanClearBias_fails() {
            answers.put("clear_bias", Double.NaN);

            assertThat(hardStopGate.evaluate(answers, stats(0, 0)).getViolations())
                    .extracting(HardStopViolation::getCode)
                    .containsExactly("CLEAR_BIAS");
        }

        @Test
        @DisplayName("Infinite sleep hours do not satisfy the sleep check")
        void infiniteSleep_fails() {
            answers.put("sleep_quality", "Infinity");

            assertThat(hardStopGate.evaluate(answers, stats(0, 0)).getViolations())
                    .extracting(HardStopViolation::getCode)
                    .containsExactly("SLEEP");
        }

        @Test
        @DisplayName("No clear bias fails when a clear bias is required")
        void noClearBias_fails() {
            answers.put("clear_bias", false);

            assertThat(hardStopGate.evaluate(answers, stats(0, 0)).getFailedChecks())
                    .containsExactly("No clear market bias");
        }

        @Test
        @DisplayName("No clear bias passes when a clear bias is not required")
        void noClearBias_notRequired_passes() {
            HardStopGate gate = new HardStopGate(RuleConfigFixtures.fromYaml(HARD_STOPS + "  require_clear_bias: false\n"
                    + "questions: {}\n"));
            answers.put("clear_bias", false);

            assertThat(gate.evaluate(answers, stats(0, 0)).isPassed()).isTrue();
        }
    }

    // ==============================
    // AGGREGATION
    // ==============================

    @Nested
    @DisplayName("Aggregation")
    class Aggregation {

        @Test
        @DisplayName("Every failing check is reported in check order")
        void allFailures_reported() {
            answers.put("sleep_quality", 3);
            answers.put("mental_state", 1);
            answers.put("clear_bias", false);

            HardStopOutcome outcome = hardStopGate.evaluate(answers, stats(4, 6));

            assertThat(outcome.getViolations())
                    .extracting(HardStopViolation::getCode)
                    .containsExactly("CONSECUTIVE_LOSSES", "DAILY_LOSS", "SLEEP", "MENTAL_STATE", "CLEAR_BIAS");
            assertThat(outcome.getReason())
                    .isEqualTo("Hard stops failed: Consecutive losses (4) >= 3; Daily loss (6%) >= 5%; "
                            + "Hours of sleep (3) < 5; Mental state (1) < 3; No clear market bias");
        }

        @Test
        @DisplayName("Missing answers read as zero or false")
        void missingAnswers_failGatingQuestions() {
            HardStopOutcome outcome = hardStopGate.evaluate(Map.of(), null);

            assertThat(outcome.getViolations())
                    .extracting(HardStopViolation::getCode)
                    .containsExactly("SLEEP", "MENTAL_STATE", "CLEAR_BIAS");
        }

        @Test
        @DisplayName("Null stats are treated as all zeros")
        void nullStats_permissive() {
            assertThat(hardStopGate.evaluate(answers, null).isPassed()).isTrue();
        }

        @Test
        @DisplayName("Evaluation is deterministic")
        void deterministic() {
            answers.put("mental_state", 1);

            assertThat(hardStopGate.evaluate(answers, stats(5, 0)))
                    .isEqualTo(hardStopGate.evaluate(answers, stats(5, 0)));
        }
    }

    // ==============================
    // CHECK SELECTION
    // ==============================

    @Nested
    @DisplayName("Check selection")
    class CheckSelection {

        @Test
        @DisplayName("All five checks run by default")
        void defaultRunsAll() {
            assertThat(hardStopGate.getRules()).containsExactly(HardStopRule.values());
        }

        @Test
        @DisplayName("hard_stops.checks restricts the gate to the listed checks")
        void checksSubset() {
            HardStopGate gate = new HardStopGate(RuleConfigFixtures.fromYaml(HARD_STOPS
                    + "  checks: [daily_loss, consecutive_losses]\n"
                    + "questions: {}\n"));

            assertThat(gate.getRules())
                    .containsExactly(HardStopRule.DAILY_LOSS, HardStopRule.CONSECUTIVE_LOSSES);
            assertThat(gate.evaluate(Map.of(), stats(0, 0)).isPassed()).isTrue();
        }
    }
}
