package com.tradingrisk.rules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;

/**
 * Typed, immutable view of the loaded rule set: hard-stop thresholds, questions per category,
 * category weights, score thresholds, lot sizing and coach settings.
 *
 * <p>Built once by {@link RuleConfigLoader} at startup and shared by reference between every
 * evaluation. Nothing in this class can be changed after construction, so concurrent readers
 * need no synchronization.
 */
@Getter
public class RuleConfig {

    /** Categories evaluated when the rule file does not list its own under {@code scoring.categories}. */
    public static final List<String> DEFAULT_CATEGORIES =
            List.of("psychology", "market_conditions", "technical_confluence");

    private final HardStopThresholds hardStops;
    private final List<String> categories;
    private final Map<String, List<QuestionSpec>> questionsByCategory;
    private final Map<String, Double> categoryWeights;
    private final ScoreThresholds scoreThresholds;
    private final LotSizingRules lotSizing;
    private final CoachSettings coach;

    public RuleConfig(
            HardStopThresholds hardStops,
            List<String> categories,
            Map<String, List<QuestionSpec>> questionsByCategory,
            Map<String, Double> categoryWeights,
            ScoreThresholds scoreThresholds,
            LotSizingRules lotSizing,
            CoachSettings coach) {
        this.hardStops = hardStops;
        this.categories = List.copyOf(categories);
        Map<String, List<QuestionSpec>> questions = new LinkedHashMap<>();
        questionsByCategory.forEach((category, specs) -> questions.put(category, List.copyOf(specs)));
        this.questionsByCategory = Collections.unmodifiableMap(questions);
        this.categoryWeights = Collections.unmodifiableMap(new LinkedHashMap<>(categoryWeights));
        this.scoreThresholds = scoreThresholds;
        this.lotSizing = lotSizing;
        this.coach = coach != null ? coach : CoachSettings.defaults();
    }

    /** Questions of one category in file order; empty if the category has none. */
    public List<QuestionSpec> getQuestions(String category) {
        return questionsByCategory.getOrDefault(category, List.of());
    }

    /** Weight of a category in the final score; 0 when the rule file does not weight it. */
    public double getCategoryWeight(String category) {
        return categoryWeights.getOrDefault(category, 0.0);
    }

    public Optional<QuestionSpec> findQuestion(String questionId) {
        return questionsByCategory.values().stream()
                .flatMap(List::stream)
                .filter(question -> question.getId().equals(questionId))
                .findFirst();
    }
}
