package com.tradingrisk.unit.scoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradingrisk.rules.QuestionKind;
import com.tradingrisk.scoring.AnswerNormalizerRegistry;
import com.tradingrisk.scoring.BooleanAnswerNormalizer;
import com.tradingrisk.scoring.NumberAnswerNormalizer;
import com.tradingrisk.scoring.ScaleAnswerNormalizer;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for AnswerNormalizerRegistry wiring checks.
 */
class AnswerNormalizerRegistryTest {

    @Test
    @DisplayName("Defaults resolve a normalizer for every kind")
    void defaults_coverEveryKind() {
        AnswerNormalizerRegistry registry = AnswerNormalizerRegistry.defaults();

        assertThat(registry.getNormalizer(QuestionKind.BOOLEAN)).isInstanceOf(BooleanAnswerNormalizer.class);
        assertThat(registry.getNormalizer(QuestionKind.SCALE)).isInstanceOf(ScaleAnswerNormalizer.class);
        assertThat(registry.getNormalizer(QuestionKind.NUMBER)).isInstanceOf(NumberAnswerNormalizer.class);
    }

    @Test
    @DisplayName("Two normalizers for one kind fail")
    void duplicateKind_fails() {
        assertThatThrownBy(() -> new AnswerNormalizerRegistry(List.of(
                        new BooleanAnswerNormalizer(),
                        new BooleanAnswerNormalizer(),
                        new ScaleAnswerNormalizer(),
                        new NumberAnswerNormalizer())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("BOOLEAN");
    }

    @Test
    @DisplayName("A kind without a normalizer fails")
    void missingKind_fails() {
        assertThatThrownBy(() -> new AnswerNormalizerRegistry(
                        List.of(new BooleanAnswerNormalizer(), new ScaleAnswerNormalizer())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("NUMBER");
    }
}
