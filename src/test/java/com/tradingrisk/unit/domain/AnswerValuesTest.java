package com.tradingrisk.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradingrisk.domain.AnswerValues;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class AnswerValuesTest {

    @Nested
    @DisplayName("Numeric reads")
    class NumericReads {

        @Test
        @DisplayName("Numbers, numeric strings and booleans are read as doubles")
        void finiteValues() {
            assertThat(AnswerValues.asDouble(7, 0)).isEqualTo(7.0);
            assertThat(AnswerValues.asDouble(" 6.5 ", 0)).isEqualTo(6.5);
            assertThat(AnswerValues.asDouble(true, 0)).isEqualTo(1.0);
            assertThat(AnswerValues.asDouble(null, 4)).isEqualTo(4.0);
        }

        @ParameterizedTest(name = "\"{0}\" is not numeric")
        @ValueSource(strings = {"NaN", "Infinity", "-Infinity", "great", ""})
        @DisplayName("Non-finite and non-numeric strings fall back to the default")
        void nonFiniteStrings(String value) {
            assertThat(AnswerValues.isNumeric(value)).isFalse();
            assertThat(AnswerValues.asDouble(value, 2)).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Non-finite numbers fall back to the default")
        void nonFiniteNumbers() {
            assertThat(AnswerValues.isNumeric(Double.NaN)).isFalse();
            assertThat(AnswerValues.isNumeric(Float.POSITIVE_INFINITY)).isFalse();
            assertThat(AnswerValues.asDouble(Double.NEGATIVE_INFINITY, 0)).isZero();
            assertThat(AnswerValues.asDouble(Double.NaN, 3)).isEqualTo(3.0);
        }
    }

    @Nested
    @DisplayName("Boolean reads")
    class BooleanReads {

        @Test
        @DisplayName("Yes/true strings and non-zero numbers are true")
        void truthyValues() {
            assertThat(AnswerValues.asBoolean(" Yes ", false)).isTrue();
            assertThat(AnswerValues.asBoolean(1, false)).isTrue();
            assertThat(AnswerValues.asBoolean(0, true)).isFalse();
            assertThat(AnswerValues.asBoolean("no", true)).isFalse();
        }

        @Test
        @DisplayName("NaN falls back to the default")
        void nanNumber() {
            assertThat(AnswerValues.asBoolean(Double.NaN, false)).isFalse();
        }
    }
}
