package com.tradingrisk.domain;

import java.util.Locale;

/**
 * Coercion of raw answer values (as collected from a form, chat or JSON body) to the numeric
 * and boolean views the engine works with.
 */
public final class AnswerValues {

    private AnswerValues() {}

    /**
     * Numeric view of an answer: numbers as-is, booleans as 1/0, numeric strings parsed.
     * NaN and infinite values read as absent and yield the default.
     */
    public static double asDouble(Object value, double defaultValue) {
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1 : 0;
        }
        Double number = finiteNumber(value);
        return number != null ? number : defaultValue;
    }

    /** Boolean view of an answer: non-zero numbers and yes/true strings count as true. NaN yields the default. */
    public static boolean asBoolean(Object value, boolean defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            double number = ((Number) value).doubleValue();
            return Double.isNaN(number) ? defaultValue : number != 0;
        }
        if (value instanceof String) {
            String text = ((String) value).trim().toLowerCase(Locale.ROOT);
            return text.equals("true") || text.equals("yes") || text.equals("y");
        }
        return defaultValue;
    }

    /** Whether the value is a finite number or a string that parses to one. */
    public static boolean isNumeric(Object value) {
        return finiteNumber(value) != null;
    }

    private static Double finiteNumber(Object value) {
        double number;
        if (value instanceof Number) {
            number = ((Number) value).doubleValue();
        } else if (value instanceof String) {
            try {
                number = Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(number) ? number : null;
    }
}
