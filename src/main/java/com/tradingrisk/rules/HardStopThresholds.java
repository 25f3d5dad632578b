package com.tradingrisk.rules;

import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Hard-stop limits from the {@code hard_stops} section of the rule file.
 *
 * <p>The question ids name which answers the sleep, mental state and clear bias checks
 * read. {@code enabledChecks} lists the check codes to run, in order.
 */
@Getter
@Builder
public class HardStopThresholds {

    private final int maxConsecutiveLosses;
    private final double maxDailyLossPercent;
    private final double minSleepHours;
    private final double psychologyMinScore;
    private final boolean requireClearBias;

    @Builder.Default
    private final String sleepQuestionId = "sleep_quality";

    @Builder.Default
    private final String mentalStateQuestionId = "mental_state";

    @Builder.Default
    private final String clearBiasQuestionId = "clear_bias";

    private final List<String> enabledChecks;
}
