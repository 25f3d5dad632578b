package com.tradingrisk.scoring;

import lombok.Builder;
import lombok.Value;

/**
 * One scored answer: the question, what the trader answered, and the normalized sub-score.
 * Created by {@link ScoreEngine} and owned by the decision that produced it.
 */
@Value
@Builder
public class AnswerRecord {

    String questionId;
    String questionText;
    Object rawAnswer;
    String category;
    double weight;

    /** Sub-score in [0, 100]. */
    double normalizedScore;
}
