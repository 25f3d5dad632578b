package com.tradingrisk.coach;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Coaching messages derived from journal history. Every field except {@code dailyMotivation}
 * and {@code generatedAt} is null when its pattern did not apply.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CoachInsights {

    String inactivityWarning;
    String psychologyInsight;
    String riskTakingInsight;
    String scoreTrendInsight;
    String hardStopInsight;
    String dailyMotivation;
    LocalDateTime generatedAt;

    /** Pattern insights that applied, in report order, excluding inactivity and motivation. */
    @JsonIgnore
    public List<String> getPatternInsights() {
        List<String> insights = new ArrayList<>();
        addIfPresent(insights, psychologyInsight);
        addIfPresent(insights, riskTakingInsight);
        addIfPresent(insights, scoreTrendInsight);
        addIfPresent(insights, hardStopInsight);
        return insights;
    }

    @JsonIgnore
    public boolean hasWarnings() {
        return inactivityWarning != null || !getPatternInsights().isEmpty();
    }

    private static void addIfPresent(List<String> insights, String insight) {
        if (insight != null) {
            insights.add(insight);
        }
    }
}
