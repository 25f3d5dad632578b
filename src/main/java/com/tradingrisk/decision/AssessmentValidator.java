package com.tradingrisk.decision;

import com.tradingrisk.domain.AnswerValues;
import com.tradingrisk.domain.DisplayFormat;
import com.tradingrisk.domain.model.AssessmentSession;
import com.tradingrisk.domain.model.TradeDetails;
import com.tradingrisk.domain.model.TradingStats;
import com.tradingrisk.exception.ValidationException;
import com.tradingrisk.rules.QuestionSpec;
import com.tradingrisk.rules.RuleConfig;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Boundary validation of an assessment before it reaches the engine.
 *
 * <p>Checks answer types against each question's kind, ranged answers against [min, max], the
 * stats ranges, and that any supplied balance or stop loss is positive. All problems are
 * collected and reported together in one {@link ValidationException}. Answers to questions the
 * rule set does not define are accepted and ignored by scoring.
 */
@Component
public class AssessmentValidator {

    private final RuleConfig ruleConfig;

    public AssessmentValidator(RuleConfig ruleConfig) {
        this.ruleConfig = ruleConfig;
    }

    public void validate(AssessmentSession session) {
        Map<String, Object> errors = new LinkedHashMap<>();
        validateAnswers(session.getAnswers(), errors);
        validateStats(session.getStats(), errors);
        validateTradeDetails(session.getTradeDetails(), errors);

        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid assessment input", errors);
        }
    }

    private void validateAnswers(Map<String, Object> answers, Map<String, Object> errors) {
        answers.forEach((questionId, rawAnswer) -> {
            Optional<QuestionSpec> question = ruleConfig.findQuestion(questionId);
            if (question.isEmpty()) {
                return;
            }
            QuestionSpec spec = question.get();
            String field = "answers." + questionId;

            if (!spec.getKind().isRanged()) {
                if (!(rawAnswer instanceof Boolean)) {
                    errors.put(field, "must be true or false");
                }
                return;
            }

            if (!AnswerValues.isNumeric(rawAnswer)) {
                errors.put(field, "must be a number");
                return;
            }
            double value = AnswerValues.asDouble(rawAnswer, 0);
            if (value < spec.getMin() || value > spec.getMax()) {
                errors.put(field, "must be between " + DisplayFormat.number(spec.getMin()) + " and "
                        + DisplayFormat.number(spec.getMax()));
            }
        });
    }

    private void validateStats(TradingStats stats, Map<String, Object> errors) {
        if (stats.getConsecutiveLosses() < 0) {
            errors.put("stats.consecutiveLosses", "must not be negative");
        }
        if (stats.getDailyLossPercent() < 0 || stats.getDailyLossPercent() > 100) {
            errors.put("stats.dailyLossPercent", "must be between 0 and 100");
        }
    }

    private void validateTradeDetails(TradeDetails tradeDetails, Map<String, Object> errors) {
        if (tradeDetails == null) {
            return;
        }
        if (tradeDetails.getBalance() != null && tradeDetails.getBalance().signum() <= 0) {
            errors.put("tradeDetails.balance", "must be positive");
        }
        if (tradeDetails.getStopLossPips() != null && tradeDetails.getStopLossPips().signum() <= 0) {
            errors.put("tradeDetails.stopLossPips", "must be positive");
        }
    }
}
