package com.tradingrisk.api.controller;

import com.tradingrisk.api.dto.request.EvaluationRequest;
import com.tradingrisk.api.dto.response.EvaluationResponse;
import com.tradingrisk.decision.AssessmentValidator;
import com.tradingrisk.decision.DecisionFormatter;
import com.tradingrisk.decision.DecisionPipeline;
import com.tradingrisk.decision.RiskDecision;
import com.tradingrisk.domain.model.AssessmentSession;
import com.tradingrisk.mapper.AssessmentDtoMapper;
import com.tradingrisk.rules.QuestionSpec;
import com.tradingrisk.rules.RuleConfig;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.mapstruct.factory.Mappers;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for running a self-assessment.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/assessment/questions -- questions grouped by category, in rule file order</li>
 *   <li>POST /api/assessment/evaluate -- validate answers and stats, return the decision</li>
 * </ul>
 *
 * <p>To size a position after a first verdict, clients post the same answers again with
 * {@code tradeDetails}; the engine recomputes everything.
 */
@RestController
@RequestMapping("/api/assessment")
public class AssessmentController {

    private final RuleConfig ruleConfig;
    private final AssessmentValidator assessmentValidator;
    private final DecisionPipeline decisionPipeline;
    private final DecisionFormatter decisionFormatter;

    private final AssessmentDtoMapper assessmentDtoMapper = Mappers.getMapper(AssessmentDtoMapper.class);

    public AssessmentController(
            RuleConfig ruleConfig,
            AssessmentValidator assessmentValidator,
            DecisionPipeline decisionPipeline,
            DecisionFormatter decisionFormatter) {
        this.ruleConfig = ruleConfig;
        this.assessmentValidator = assessmentValidator;
        this.decisionPipeline = decisionPipeline;
        this.decisionFormatter = decisionFormatter;
    }

    @GetMapping("/questions")
    public ResponseEntity<Map<String, List<QuestionSpec>>> getQuestions() {
        return ResponseEntity.ok(ruleConfig.getQuestionsByCategory());
    }

    @PostMapping("/evaluate")
    public ResponseEntity<EvaluationResponse> evaluate(@Valid @RequestBody EvaluationRequest request) {
        AssessmentSession session = assessmentDtoMapper.toSession(request);
        assessmentValidator.validate(session);

        RiskDecision decision = decisionPipeline.evaluate(session);
        return ResponseEntity.ok(EvaluationResponse.builder()
                .decision(decision)
                .summary(decisionFormatter.formatDecision(decision))
                .breakdown(decisionFormatter.formatBreakdown(decision))
                .build());
    }
}
