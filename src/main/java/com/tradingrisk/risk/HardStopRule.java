package com.tradingrisk.risk;

import com.tradingrisk.domain.AnswerValues;
import com.tradingrisk.domain.DisplayFormat;
import com.tradingrisk.domain.model.TradingStats;
import com.tradingrisk.exception.ConfigurationException;
import com.tradingrisk.rules.HardStopThresholds;
import java.util.Map;
import java.util.Optional;

/**
 * The table of hard-stop checks. Each constant inspects the stats and answers against the
 * configured thresholds and yields a violation when trading must be blocked.
 *
 * <p>Absent answers read as 0 (or false for the bias question), so an unanswered gating
 * question fails its check.
 */
public enum HardStopRule {
    CONSECUTIVE_LOSSES {
        @Override
        public Optional<HardStopViolation> check(
                Map<String, Object> answers, TradingStats stats, HardStopThresholds thresholds) {
            int losses = stats.getConsecutiveLosses();
            if (losses >= thresholds.getMaxConsecutiveLosses()) {
                return violation("Consecutive losses (" + losses + ") >= " + thresholds.getMaxConsecutiveLosses());
            }
            return Optional.empty();
        }
    },

    DAILY_LOSS {
        @Override
        public Optional<HardStopViolation> check(
                Map<String, Object> answers, TradingStats stats, HardStopThresholds thresholds) {
            double dailyLoss = stats.getDailyLossPercent();
            if (dailyLoss >= thresholds.getMaxDailyLossPercent()) {
                return violation("Daily loss (" + DisplayFormat.number(dailyLoss) + "%) >= "
                        + DisplayFormat.number(thresholds.getMaxDailyLossPercent()) + "%");
            }
            return Optional.empty();
        }
    },

    SLEEP {
        @Override
        public Optional<HardStopViolation> check(
                Map<String, Object> answers, TradingStats stats, HardStopThresholds thresholds) {
            double sleepHours = AnswerValues.asDouble(answers.get(thresholds.getSleepQuestionId()), 0);
            if (sleepHours < thresholds.getMinSleepHours()) {
                return violation("Hours of sleep (" + DisplayFormat.number(sleepHours) + ") < "
                        + DisplayFormat.number(thresholds.getMinSleepHours()));
            }
            return Optional.empty();
        }
    },

    MENTAL_STATE {
        @Override
        public Optional<HardStopViolation> check(
                Map<String, Object> answers, TradingStats stats, HardStopThresholds thresholds) {
            double mentalState = AnswerValues.asDouble(answers.get(thresholds.getMentalStateQuestionId()), 0);
            if (mentalState < thresholds.getPsychologyMinScore()) {
                return violation("Mental state (" + DisplayFormat.number(mentalState) + ") < "
                        + DisplayFormat.number(thresholds.getPsychologyMinScore()));
            }
            return Optional.empty();
        }
    },

    CLEAR_BIAS {
        @Override
        public Optional<HardStopViolation> check(
                Map<String, Object> answers, TradingStats stats, HardStopThresholds thresholds) {
            if (thresholds.isRequireClearBias()
                    && !AnswerValues.asBoolean(answers.get(thresholds.getClearBiasQuestionId()), false)) {
                return violation("No clear market bias");
            }
            return Optional.empty();
        }
    };

    public abstract Optional<HardStopViolation> check(
            Map<String, Object> answers, TradingStats stats, HardStopThresholds thresholds);

    Optional<HardStopViolation> violation(String message) {
        return Optional.of(HardStopViolation.of(name(), message));
    }

    /** Resolves a check code from the rule file, case-insensitively. */
    public static HardStopRule fromCode(String code) {
        for (HardStopRule rule : values()) {
            if (rule.name().equalsIgnoreCase(code.trim())) {
                return rule;
            }
        }
        throw new ConfigurationException("Unknown hard-stop check: " + code);
    }
}
