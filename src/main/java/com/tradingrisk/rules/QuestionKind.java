package com.tradingrisk.rules;

import com.tradingrisk.exception.ConfigurationException;
import java.util.Locale;

/**
 * Answer type of a self-assessment question, as declared by the {@code type} key of the rule file.
 */
public enum QuestionKind {
    BOOLEAN,
    SCALE,
    NUMBER;

    /** Whether answers of this kind are bounded by the question's min/max range. */
    public boolean isRanged() {
        return this != BOOLEAN;
    }

    public static QuestionKind fromConfig(String value) {
        try {
            return QuestionKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown question type: " + value, e);
        }
    }
}
