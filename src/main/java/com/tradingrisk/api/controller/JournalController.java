package com.tradingrisk.api.controller;

import com.tradingrisk.api.dto.request.JournalEntryRequest;
import com.tradingrisk.decision.AssessmentValidator;
import com.tradingrisk.decision.DecisionPipeline;
import com.tradingrisk.decision.RiskDecision;
import com.tradingrisk.domain.model.AssessmentSession;
import com.tradingrisk.journal.JournalEntry;
import com.tradingrisk.journal.JournalService;
import com.tradingrisk.journal.JournalStats;
import com.tradingrisk.mapper.AssessmentDtoMapper;
import jakarta.validation.Valid;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the session journal.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/journal -- evaluate an assessment and save it with notes</li>
 *   <li>GET /api/journal -- recent entries, oldest first ({@code limit}, {@code tradedOnly})</li>
 *   <li>GET /api/journal/stats -- session statistics over the last {@code days} days</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/journal")
public class JournalController {

    private static final Logger log = LoggerFactory.getLogger(JournalController.class);

    private final AssessmentValidator assessmentValidator;
    private final DecisionPipeline decisionPipeline;
    private final JournalService journalService;

    private final AssessmentDtoMapper assessmentDtoMapper = Mappers.getMapper(AssessmentDtoMapper.class);

    public JournalController(
            AssessmentValidator assessmentValidator, DecisionPipeline decisionPipeline, JournalService journalService) {
        this.assessmentValidator = assessmentValidator;
        this.decisionPipeline = decisionPipeline;
        this.journalService = journalService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public JournalEntry record(@Valid @RequestBody JournalEntryRequest request) {
        AssessmentSession session = assessmentDtoMapper.toSession(request.getAssessment());
        assessmentValidator.validate(session);

        RiskDecision decision = decisionPipeline.evaluate(session);
        log.info("Recording journal entry (trade={})", decision.isShouldTrade());
        return journalService.record(session, decision, request.getNotes());
    }

    @GetMapping
    public List<JournalEntry> getEntries(
            @RequestParam(defaultValue = "20") int limit, @RequestParam(defaultValue = "false") boolean tradedOnly) {
        return journalService.getEntries(limit, tradedOnly);
    }

    @GetMapping("/stats")
    public JournalStats getStats(@RequestParam(defaultValue = "7") int days) {
        return journalService.getStats(days);
    }
}
