package com.tradingrisk.coach;

import com.tradingrisk.domain.AnswerValues;
import com.tradingrisk.journal.JournalEntry;
import com.tradingrisk.journal.JournalService;
import com.tradingrisk.journal.JournalStats;
import com.tradingrisk.rules.CoachSettings;
import com.tradingrisk.rules.RuleConfig;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.random.RandomGenerator;
import org.springframework.stereotype.Service;

/**
 * Looks for behavioural patterns in the journal and turns them into short coaching messages.
 *
 * <p>Patterns (each needs a minimum amount of history before it says anything):
 * <ul>
 *   <li><b>Inactivity:</b> days since the last recommended trade reach {@code coach.days_inactive_warning}</li>
 *   <li><b>Psychology:</b> average mental state / emotional control over the last 7 sessions (3+)</li>
 *   <li><b>Risk taking:</b> share of 3% trades among the last 10 traded sessions (5+)</li>
 *   <li><b>Score trend:</b> last 3 vs first 3 of the last 10 sessions (5+)</li>
 *   <li><b>Hard stops:</b> share of blocked sessions among the last 10 (5+)</li>
 * </ul>
 *
 * <p>Message selection uses the injected {@link RandomGenerator}, so a fixed generator makes it
 * deterministic.
 */
@Service
public class TradingCoach {

    static final String EMOTIONAL_CONTROL_QUESTION = "emotional_control";

    static final List<String> DAILY_MOTIVATIONS = List.of(
            "Consistency beats talent every time.",
            "One day at a time. Every decision counts.",
            "You don't need to trade every day. You need to trade well.",
            "Your best trade is the one you skip when conditions aren't there.",
            "Trading is a marathon, not a sprint.",
            "Every session is a chance to learn.",
            "Trust your process. Results will follow.",
            "Patience is the most profitable skill in trading.");

    private final JournalService journalService;
    private final CoachSettings coachSettings;
    private final String mentalStateQuestionId;
    private final RandomGenerator random;
    private final Clock clock;

    public TradingCoach(JournalService journalService, RuleConfig ruleConfig, RandomGenerator random, Clock clock) {
        this.journalService = journalService;
        this.coachSettings = ruleConfig.getCoach();
        this.mentalStateQuestionId = ruleConfig.getHardStops().getMentalStateQuestionId();
        this.random = random;
        this.clock = clock;
    }

    public Optional<String> checkInactivity() {
        Optional<Long> daysInactive = journalService.daysSinceLastTrade();
        if (daysInactive.isEmpty() || daysInactive.get() < coachSettings.getDaysInactiveWarning()) {
            return Optional.empty();
        }

        long days = daysInactive.get();
        List<String> messages = coachSettings.getMotivationalMessages();
        if (messages.isEmpty()) {
            return Optional.of("You haven't traded for " + days + " days. How about reviewing the market?");
        }
        return Optional.of(pick(messages).replace("{days}", String.valueOf(days)));
    }

    public Optional<String> analyzePsychologyPattern() {
        List<JournalEntry> entries = journalService.getEntries(7, false);
        if (entries.size() < 3) {
            return Optional.empty();
        }

        List<Double> scores = new ArrayList<>();
        for (JournalEntry entry : entries) {
            for (String questionId : List.of(mentalStateQuestionId, EMOTIONAL_CONTROL_QUESTION)) {
                Object answer = entry.getAnswers().get(questionId);
                if (AnswerValues.isNumeric(answer)) {
                    scores.add(AnswerValues.asDouble(answer, 0));
                }
            }
        }
        if (scores.isEmpty()) {
            return Optional.empty();
        }

        double average = scores.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        if (average < 3) {
            return Optional.of("Your mental state has been low lately. Consider taking a break or talking to someone.");
        }
        if (average < 3.5) {
            return Optional.of(
                    "Your psychology has been irregular. You may need a more consistent routine before trading.");
        }
        return Optional.empty();
    }

    public Optional<String> analyzeRiskTakingPattern() {
        List<JournalEntry> entries = journalService.getEntries(10, true);
        if (entries.size() < 5) {
            return Optional.empty();
        }

        long elevated = entries.stream().filter(entry -> entry.getRiskPercent() == 3.0).count();
        double elevatedShare = elevated * 100.0 / entries.size();
        if (elevatedShare > 80) {
            return Optional.of("You are taking 3% risk on most of your trades. "
                    + "Make sure you really have the confluences for it.");
        }
        if (elevatedShare < 20) {
            return Optional.of("You have been very conservative lately. Are your criteria too strict? "
                    + "Take the trades when conditions are good.");
        }
        return Optional.empty();
    }

    public Optional<String> analyzeScoreTrend() {
        List<JournalEntry> entries = journalService.getEntries(10, false);
        if (entries.size() < 5) {
            return Optional.empty();
        }

        double oldAverage = averageScore(entries.subList(0, 3));
        double recentAverage = averageScore(entries.subList(entries.size() - 3, entries.size()));
        if (recentAverage < oldAverage - 10) {
            return Optional.of("Your scores have been falling. Is something affecting your analysis? "
                    + "Review your methodology or take a break.");
        }
        if (recentAverage > oldAverage + 10) {
            return Optional.of("Your scores are improving. Keep refining your process.");
        }
        return Optional.empty();
    }

    public Optional<String> analyzeHardStopTriggers() {
        List<JournalEntry> entries = journalService.getEntries(10, false);
        if (entries.size() < 5) {
            return Optional.empty();
        }

        long failed = entries.stream().filter(entry -> !entry.isHardStopsPassed()).count();
        if (failed > entries.size() * 0.3) {
            return Optional.of("You are failing hard stops often. The system is protecting you, "
                    + "but work on the areas that keep stopping you.");
        }
        return Optional.empty();
    }

    public String getDailyMotivation() {
        return pick(DAILY_MOTIVATIONS);
    }

    public CoachInsights getInsights() {
        return CoachInsights.builder()
                .inactivityWarning(checkInactivity().orElse(null))
                .psychologyInsight(analyzePsychologyPattern().orElse(null))
                .riskTakingInsight(analyzeRiskTakingPattern().orElse(null))
                .scoreTrendInsight(analyzeScoreTrend().orElse(null))
                .hardStopInsight(analyzeHardStopTriggers().orElse(null))
                .dailyMotivation(getDailyMotivation())
                .generatedAt(LocalDateTime.now(clock))
                .build();
    }

    /**
     * Seven-day summary: session counts, average score, risk distribution and pattern insights.
     */
    public String getWeeklyReport() {
        JournalStats stats = journalService.getStats(7);
        CoachInsights insights = getInsights();

        List<String> lines = new ArrayList<>();
        lines.add("WEEKLY REPORT");
        lines.add("Summary:");
        lines.add("  - Sessions completed: " + stats.getTotalSessions());
        lines.add("  - Trades taken: " + stats.getTradesTaken());
        lines.add("  - Average score: " + stats.getAvgScore() + "/100");
        lines.add("  - Trade rate: " + stats.getTradeRate() + "%");
        lines.add("Risk distribution:");
        lines.add("  - 2% risk: " + stats.getRisk2PercentCount() + " trades");
        lines.add("  - 3% risk: " + stats.getRisk3PercentCount() + " trades");
        lines.add("Coach insights:");
        insights.getPatternInsights().forEach(insight -> lines.add("  - " + insight));
        lines.add(insights.getDailyMotivation());
        return String.join("\n", lines);
    }

    private String pick(List<String> messages) {
        return messages.get(random.nextInt(messages.size()));
    }

    private static double averageScore(List<JournalEntry> entries) {
        return entries.stream().mapToDouble(JournalEntry::getFinalScore).average().orElse(0);
    }
}
