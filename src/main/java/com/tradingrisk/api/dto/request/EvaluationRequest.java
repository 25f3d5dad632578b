package com.tradingrisk.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * REST API request DTO for evaluating one self-assessment.
 * Answers are keyed by question id; their types are checked against the rule set by
 * {@link com.tradingrisk.decision.AssessmentValidator}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EvaluationRequest {

    @NotNull
    private Map<String, Object> answers;

    @Valid
    private StatsRequest stats;

    @Valid
    private TradeDetailsRequest tradeDetails;
}
