package com.tradingrisk.scoring;

import com.tradingrisk.rules.QuestionKind;
import com.tradingrisk.rules.QuestionSpec;

/**
 * Converts a raw answer into a 0-100 sub-score for one {@link QuestionKind}.
 *
 * <p>Implementations are resolved by {@link AnswerNormalizerRegistry}. Results must always lie
 * within [0, 100].
 */
public interface AnswerNormalizer {

    /**
     * Normalizes a raw answer.
     *
     * @param questionSpec the question being answered
     * @param rawAnswer the value the trader supplied
     * @return score in [0, 100]
     */
    double normalize(QuestionSpec questionSpec, Object rawAnswer);

    /**
     * Returns the question kind this implementation handles.
     */
    QuestionKind getKind();
}
