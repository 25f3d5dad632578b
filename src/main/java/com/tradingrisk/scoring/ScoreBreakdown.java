package com.tradingrisk.scoring;

import java.util.List;
import java.util.Map;
import lombok.Value;

/**
 * Final weighted score together with the per-category scores (in category order) and every
 * scored answer.
 */
@Value
public class ScoreBreakdown {

    double finalScore;
    Map<String, Double> categoryScores;
    List<AnswerRecord> answers;
}
