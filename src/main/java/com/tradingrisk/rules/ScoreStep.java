package com.tradingrisk.rules;

import java.util.List;
import lombok.Value;

/**
 * One step of a {@code number} question's scoring curve: answers at or above {@code at}
 * score {@code score}, unless a higher step also matches.
 */
@Value
public class ScoreStep {

    /** Curve applied to the sleep question when the rule file declares no steps for it. */
    public static final List<ScoreStep> DEFAULT_SLEEP_CURVE =
            List.of(new ScoreStep(8, 100), new ScoreStep(6, 70), new ScoreStep(5, 50));

    double at;
    double score;
}
