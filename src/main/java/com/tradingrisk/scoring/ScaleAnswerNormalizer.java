package com.tradingrisk.scoring;

import com.tradingrisk.domain.AnswerValues;
import com.tradingrisk.rules.QuestionKind;
import com.tradingrisk.rules.QuestionSpec;
import org.springframework.stereotype.Component;

/**
 * Scale answers are rescaled linearly from [min, max] to [0, 100] and clamped.
 *
 * <p>Formula: (raw - min) / (max - min) * 100. On a 1-5 scale, 1 scores 0, 3 scores 50 and
 * 5 scores 100. The rule loader guarantees max > min.
 */
@Component
public class ScaleAnswerNormalizer implements AnswerNormalizer {

    @Override
    public double normalize(QuestionSpec questionSpec, Object rawAnswer) {
        double min = questionSpec.getMin();
        double max = questionSpec.getMax();
        double raw = AnswerValues.asDouble(rawAnswer, min);

        double normalized = (raw - min) / (max - min) * 100;
        return Math.max(0, Math.min(100, normalized));
    }

    @Override
    public QuestionKind getKind() {
        return QuestionKind.SCALE;
    }
}
