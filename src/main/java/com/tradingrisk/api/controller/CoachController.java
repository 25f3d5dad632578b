package com.tradingrisk.api.controller;

import com.tradingrisk.coach.CoachInsights;
import com.tradingrisk.coach.TradingCoach;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for coaching messages built from the journal.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/coach/insights -- pattern insights and a daily motivation</li>
 *   <li>GET /api/coach/weekly-report -- plain-text seven-day report</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/coach")
public class CoachController {

    private final TradingCoach tradingCoach;

    public CoachController(TradingCoach tradingCoach) {
        this.tradingCoach = tradingCoach;
    }

    @GetMapping("/insights")
    public ResponseEntity<CoachInsights> getInsights() {
        return ResponseEntity.ok(tradingCoach.getInsights());
    }

    @GetMapping(value = "/weekly-report", produces = MediaType.TEXT_PLAIN_VALUE)
    public String getWeeklyReport() {
        return tradingCoach.getWeeklyReport();
    }
}
