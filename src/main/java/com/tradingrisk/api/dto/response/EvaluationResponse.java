package com.tradingrisk.api.dto.response;

import com.tradingrisk.decision.RiskDecision;
import lombok.Builder;
import lombok.Getter;

/**
 * Decision plus its text renderings, for clients that display the verdict as-is.
 */
@Getter
@Builder
public class EvaluationResponse {

    private final RiskDecision decision;
    private final String summary;
    private final String breakdown;
}
