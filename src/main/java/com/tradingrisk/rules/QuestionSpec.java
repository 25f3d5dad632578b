package com.tradingrisk.rules;

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * Immutable definition of one self-assessment question, loaded once from the rule file.
 *
 * <p>{@code min}/{@code max} are only meaningful for {@link QuestionKind#SCALE} and
 * {@link QuestionKind#NUMBER}; the loader guarantees {@code min < max} for those kinds.
 * {@code steps} is sorted by descending threshold.
 */
@Getter
@Builder
@ToString
public class QuestionSpec {

    private final String id;
    private final String text;
    private final String category;
    private final QuestionKind kind;
    private final Double min;
    private final Double max;

    @Builder.Default
    private final double weight = 1.0;

    private final boolean reverseScore;

    @Singular
    private final List<ScoreStep> steps;
}
