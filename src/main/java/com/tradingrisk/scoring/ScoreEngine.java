package com.tradingrisk.scoring;

import com.tradingrisk.rules.QuestionSpec;
import com.tradingrisk.rules.RuleConfig;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns raw answers into normalized sub-scores, category scores and a final weighted score.
 *
 * <p>Aggregation:
 * <ul>
 *   <li><b>Category:</b> sum(normalized * weight) / sum(weight) over the answered questions of
 *       that category. Unanswered questions are skipped, not defaulted. A category with no
 *       answered (or only zero-weight) questions scores 0.</li>
 *   <li><b>Final:</b> sum(categoryScore * categoryWeight) / sum(categoryWeight) over the
 *       configured categories. Zero-weight categories drop out; 0 if every weight is 0.</li>
 * </ul>
 *
 * <p>No I/O and no state beyond the immutable rule set.
 */
@Service
public class ScoreEngine {

    private static final Logger log = LoggerFactory.getLogger(ScoreEngine.class);

    private final RuleConfig ruleConfig;
    private final AnswerNormalizerRegistry answerNormalizerRegistry;

    public ScoreEngine(RuleConfig ruleConfig, AnswerNormalizerRegistry answerNormalizerRegistry) {
        this.ruleConfig = ruleConfig;
        this.answerNormalizerRegistry = answerNormalizerRegistry;
    }

    /**
     * Normalizes one raw answer to [0, 100] using the normalizer for the question's kind.
     */
    public double normalize(QuestionSpec questionSpec, Object rawAnswer) {
        return answerNormalizerRegistry.getNormalizer(questionSpec.getKind()).normalize(questionSpec, rawAnswer);
    }

    /**
     * Scores one category.
     *
     * @param category category name as used in the rule file
     * @param answers raw answers keyed by question id
     * @return weighted mean score and the scored answers, in question order
     */
    public CategoryScore scoreCategory(String category, Map<String, Object> answers) {
        List<AnswerRecord> records = new ArrayList<>();
        double totalWeightedScore = 0;
        double totalWeight = 0;

        for (QuestionSpec questionSpec : ruleConfig.getQuestions(category)) {
            if (!answers.containsKey(questionSpec.getId())) {
                continue;
            }

            Object rawAnswer = answers.get(questionSpec.getId());
            double normalized = normalize(questionSpec, rawAnswer);
            records.add(AnswerRecord.builder()
                    .questionId(questionSpec.getId())
                    .questionText(questionSpec.getText())
                    .rawAnswer(rawAnswer)
                    .category(category)
                    .weight(questionSpec.getWeight())
                    .normalizedScore(normalized)
                    .build());

            totalWeightedScore += normalized * questionSpec.getWeight();
            totalWeight += questionSpec.getWeight();
            log.debug("Scored {}={} as {} (weight {})", questionSpec.getId(), rawAnswer, normalized,
                    questionSpec.getWeight());
        }

        double score = totalWeight > 0 ? totalWeightedScore / totalWeight : 0;
        return new CategoryScore(category, score, Collections.unmodifiableList(records));
    }

    /**
     * Scores every configured category and combines them into the final score.
     *
     * @param answers raw answers keyed by question id
     * @return final score, per-category scores and all scored answers
     */
    public ScoreBreakdown scoreFinal(Map<String, Object> answers) {
        Map<String, Double> categoryScores = new LinkedHashMap<>();
        List<AnswerRecord> allAnswers = new ArrayList<>();
        double totalWeightedScore = 0;
        double totalWeight = 0;

        for (String category : ruleConfig.getCategories()) {
            CategoryScore categoryScore = scoreCategory(category, answers);
            categoryScores.put(category, categoryScore.getScore());
            allAnswers.addAll(categoryScore.getAnswers());

            double categoryWeight = ruleConfig.getCategoryWeight(category);
            totalWeightedScore += categoryScore.getScore() * categoryWeight;
            totalWeight += categoryWeight;
        }

        double finalScore = totalWeight > 0 ? totalWeightedScore / totalWeight : 0;
        log.debug("Final score {} from category scores {}", finalScore, categoryScores);
        return new ScoreBreakdown(
                finalScore, Collections.unmodifiableMap(categoryScores), Collections.unmodifiableList(allAnswers));
    }
}
