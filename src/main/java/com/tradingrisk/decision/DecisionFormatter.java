package com.tradingrisk.decision;

import com.tradingrisk.domain.DisplayFormat;
import com.tradingrisk.scoring.AnswerRecord;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Renders a {@link RiskDecision} as plain text for chat and terminal front ends.
 */
@Component
public class DecisionFormatter {

    static final double GOOD_SCORE = 70;
    static final double CAUTION_SCORE = 40;

    private static final String RULE = "=".repeat(60);

    /**
     * Verdict summary: the hard-stop reason when blocked, otherwise the final and category scores,
     * the recommended risk and, when computed, the lot size.
     */
    public String formatDecision(RiskDecision decision) {
        List<String> lines = new ArrayList<>();
        lines.add(RULE);
        lines.add("TRADING DECISION");
        lines.add(RULE);

        if (decision.getHardStopOutcome().isFailed()) {
            lines.add("NO TRADING TODAY");
            lines.add("Reason: " + decision.getHardStopOutcome().getReason());
            return String.join("\n", lines);
        }

        lines.add("Final score: " + DisplayFormat.oneDecimal(decision.getFinalScore()) + "/100");
        lines.add("Category scores:");
        decision.getCategoryScores().forEach((category, score) ->
                lines.add("  - " + displayName(category) + ": " + DisplayFormat.oneDecimal(score) + "/100"));
        lines.add(RULE);

        if (decision.isShouldTrade()) {
            lines.add("You may trade with " + DisplayFormat.number(decision.getRiskPercent()) + "% risk");
            if (decision.getLotSize() != null) {
                lines.add("Recommended lot size: " + decision.getLotSize().toPlainString() + " lots");
            }
        } else {
            lines.add("DO NOT TRADE TODAY");
            lines.add("The score is too low. Wait for better conditions.");
        }
        lines.add(RULE);
        return String.join("\n", lines);
    }

    /**
     * Per-answer breakdown grouped by category, each answer flagged good, caution or poor.
     */
    public String formatBreakdown(RiskDecision decision) {
        Map<String, List<AnswerRecord>> byCategory = new LinkedHashMap<>();
        for (AnswerRecord answer : decision.getAnswers()) {
            byCategory.computeIfAbsent(answer.getCategory(), key -> new ArrayList<>()).add(answer);
        }

        List<String> lines = new ArrayList<>();
        lines.add(RULE);
        lines.add("DETAILED BREAKDOWN");
        lines.add(RULE);
        byCategory.forEach((category, answers) -> {
            lines.add(displayName(category));
            lines.add("-".repeat(60));
            for (AnswerRecord answer : answers) {
                lines.add("  [" + flag(answer.getNormalizedScore()) + "] " + answer.getQuestionText());
                lines.add("     Answer: " + answer.getRawAnswer() + " | Score: "
                        + DisplayFormat.oneDecimal(answer.getNormalizedScore()) + "/100");
            }
        });
        return String.join("\n", lines);
    }

    static String flag(double normalizedScore) {
        if (normalizedScore >= GOOD_SCORE) {
            return "GOOD";
        }
        if (normalizedScore >= CAUTION_SCORE) {
            return "CAUTION";
        }
        return "POOR";
    }

    /** "market_conditions" becomes "Market Conditions". */
    static String displayName(String category) {
        String[] words = category.split("_");
        StringBuilder name = new StringBuilder();
        for (String word : words) {
            if (word.isEmpty()) {
                continue;
            }
            if (name.length() > 0) {
                name.append(' ');
            }
            name.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return name.toString();
    }
}
