package com.tradingrisk.unit.decision;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.tradingrisk.decision.AssessmentValidator;
import com.tradingrisk.domain.model.AssessmentSession;
import com.tradingrisk.domain.model.TradeDetails;
import com.tradingrisk.domain.model.TradingStats;
import com.tradingrisk.exception.ErrorCode;
import com.tradingrisk.exception.ValidationException;
import com.tradingrisk.unit.RuleConfigFixtures;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Unit tests for AssessmentValidator boundary checks.
 */
class AssessmentValidatorTest {

    private AssessmentValidator validator;

    @BeforeEach
    void setUp() {
        validator = new AssessmentValidator(RuleConfigFixtures.standard());
    }

    private static AssessmentSession session(Map<String, Object> answers) {
        return AssessmentSession.builder().answers(answers).build();
    }

    @Test
    @DisplayName("Well-formed assessment passes")
    void validAssessment_passes() {
        AssessmentSession session = AssessmentSession.builder()
                .answers(RuleConfigFixtures.passingAnswers())
                .stats(TradingStats.builder().consecutiveLosses(2).dailyLossPercent(1.5).build())
                .tradeDetails(TradeDetails.builder()
                        .balance(new BigDecimal("5000"))
                        .stopLossPips(new BigDecimal("15"))
                        .instrument("GBPUSD")
                        .build())
                .build();

        assertThatCode(() -> validator.validate(session)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Answers to unknown questions are accepted")
    void unknownQuestion_accepted() {
        Map<String, Object> answers = new HashMap<>(RuleConfigFixtures.passingAnswers());
        answers.put("favourite_colour", "blue");

        assertThatCode(() -> validator.validate(session(answers))).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Every problem is collected into one exception")
    void collectsAllErrors() {
        Map<String, Object> answers = new HashMap<>();
        answers.put("clear_bias", "maybe");
        answers.put("volatility", "high");
        answers.put("mental_state", 11);
        AssessmentSession session = AssessmentSession.builder()
                .answers(answers)
                .stats(TradingStats.builder().consecutiveLosses(-1).dailyLossPercent(120).build())
                .tradeDetails(TradeDetails.builder()
                        .balance(BigDecimal.ZERO)
                        .stopLossPips(new BigDecimal("-2"))
                        .build())
                .build();

        ValidationException exception =
                catchThrowableOfType(() -> validator.validate(session), ValidationException.class);

        assertThat(exception.getErrorCode()).isEqualTo(ErrorCode.VALIDATION_ERROR);
        assertThat(exception.getDetails())
                .containsEntry("answers.clear_bias", "must be true or false")
                .containsEntry("answers.volatility", "must be a number")
                .containsEntry("answers.mental_state", "must be between 0 and 10")
                .containsEntry("stats.consecutiveLosses", "must not be negative")
                .containsEntry("stats.dailyLossPercent", "must be between 0 and 100")
                .containsEntry("tradeDetails.balance", "must be positive")
                .containsEntry("tradeDetails.stopLossPips", "must be positive");
    }

    @Test
    @DisplayName("Numeric strings within range are accepted for scale questions")
    void numericString_accepted() {
        assertThatCode(() -> validator.validate(session(Map.of("volatility", "4"))))
                .doesNotThrowAnyException();
    }

    @ParameterizedTest(name = "\"{0}\" is rejected for scale and number questions")
    @ValueSource(strings = {"NaN", "Infinity", "-Infinity", " NaN "})
    @DisplayName("Non-finite numeric strings are rejected")
    void nonFiniteString_rejected(String value) {
        Map<String, Object> answers = new HashMap<>(RuleConfigFixtures.passingAnswers());
        answers.put("mental_state", value);
        answers.put("sleep_quality", value);

        ValidationException exception =
                catchThrowableOfType(() -> validator.validate(session(answers)), ValidationException.class);

        assertThat(exception.getDetails())
                .containsEntry("answers.mental_state", "must be a number")
                .containsEntry("answers.sleep_quality", "must be a number");
    }

    @Test
    @DisplayName("Non-finite numbers are rejected")
    void nonFiniteNumber_rejected() {
        Map<String, Object> answers = new HashMap<>(RuleConfigFixtures.passingAnswers());
        answers.put("volatility", Double.NaN);
        answers.put("sleep_quality", Double.POSITIVE_INFINITY);

        ValidationException exception =
                catchThrowableOfType(() -> validator.validate(session(answers)), ValidationException.class);

        assertThat(exception.getDetails())
                .containsOnlyKeys("answers.volatility", "answers.sleep_quality");
    }
}
