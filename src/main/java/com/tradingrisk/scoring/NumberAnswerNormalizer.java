package com.tradingrisk.scoring;

import com.tradingrisk.domain.AnswerValues;
import com.tradingrisk.rules.QuestionKind;
import com.tradingrisk.rules.QuestionSpec;
import com.tradingrisk.rules.ScoreStep;
import org.springframework.stereotype.Component;

/**
 * Numeric answers are scored with the question's step curve: the highest step whose
 * threshold the answer reaches gives the score, and answers below every step score 0.
 *
 * <p>For sleep hours the default curve is 8h = 100, 6h = 70, 5h = 50, less = 0. A number
 * question configured without steps always scores 0.
 */
@Component
public class NumberAnswerNormalizer implements AnswerNormalizer {

    @Override
    public double normalize(QuestionSpec questionSpec, Object rawAnswer) {
        double value = AnswerValues.asDouble(rawAnswer, 0);
        for (ScoreStep step : questionSpec.getSteps()) {
            if (value >= step.getAt()) {
                return step.getScore();
            }
        }
        return 0;
    }

    @Override
    public QuestionKind getKind() {
        return QuestionKind.NUMBER;
    }
}
