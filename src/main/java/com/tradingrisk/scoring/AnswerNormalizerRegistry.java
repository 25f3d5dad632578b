package com.tradingrisk.scoring;

import com.tradingrisk.rules.QuestionKind;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Resolves an {@link AnswerNormalizer} by {@link QuestionKind}.
 *
 * <p>Spring discovers every AnswerNormalizer bean and this registry indexes them by kind at
 * construction time. Registering two normalizers for one kind, or leaving a kind without one,
 * is a wiring error and fails startup.
 */
@Component
public class AnswerNormalizerRegistry {

    private final Map<QuestionKind, AnswerNormalizer> normalizersByKind = new EnumMap<>(QuestionKind.class);

    public AnswerNormalizerRegistry(List<AnswerNormalizer> answerNormalizers) {
        for (AnswerNormalizer answerNormalizer : answerNormalizers) {
            AnswerNormalizer previous = normalizersByKind.put(answerNormalizer.getKind(), answerNormalizer);
            if (previous != null) {
                throw new IllegalStateException("Two normalizers registered for kind " + answerNormalizer.getKind()
                        + ": " + previous.getClass().getSimpleName() + ", "
                        + answerNormalizer.getClass().getSimpleName());
            }
        }
        for (QuestionKind kind : QuestionKind.values()) {
            if (!normalizersByKind.containsKey(kind)) {
                throw new IllegalStateException("No answer normalizer registered for kind " + kind);
            }
        }
    }

    /** Registry with the built-in normalizers, for use outside a Spring context. */
    public static AnswerNormalizerRegistry defaults() {
        return new AnswerNormalizerRegistry(
                List.of(new BooleanAnswerNormalizer(), new ScaleAnswerNormalizer(), new NumberAnswerNormalizer()));
    }

    public AnswerNormalizer getNormalizer(QuestionKind kind) {
        return normalizersByKind.get(kind);
    }
}
