package com.tradingrisk.rules;

import java.util.List;
import lombok.Value;

/**
 * Optional {@code coach} section: inactivity warning threshold and the messages the coach
 * picks from. Messages may contain a {@code {days}} placeholder.
 */
@Value
public class CoachSettings {

    public static final int DEFAULT_DAYS_INACTIVE_WARNING = 3;

    int daysInactiveWarning;
    List<String> motivationalMessages;

    public static CoachSettings defaults() {
        return new CoachSettings(DEFAULT_DAYS_INACTIVE_WARNING, List.of());
    }
}
