package com.tradingrisk.scoring;

import com.tradingrisk.domain.AnswerValues;
import com.tradingrisk.rules.QuestionKind;
import com.tradingrisk.rules.QuestionSpec;
import org.springframework.stereotype.Component;

/**
 * Yes/no answers: yes scores 100, no scores 0. Questions marked {@code reverse_score} invert
 * that, for questions where "yes" is the risky answer (e.g. "are you trading to recover a loss?").
 */
@Component
public class BooleanAnswerNormalizer implements AnswerNormalizer {

    @Override
    public double normalize(QuestionSpec questionSpec, Object rawAnswer) {
        double score = AnswerValues.asBoolean(rawAnswer, false) ? 100 : 0;
        return questionSpec.isReverseScore() ? 100 - score : score;
    }

    @Override
    public QuestionKind getKind() {
        return QuestionKind.BOOLEAN;
    }
}
