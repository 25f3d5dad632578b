package com.tradingrisk.journal;

import com.tradingrisk.decision.RiskDecision;
import com.tradingrisk.domain.model.AssessmentSession;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Records assessment sessions and answers history queries for the coach and the API.
 *
 * <p>The decision engine never reads from here; history only flows into coaching.
 */
@Service
public class JournalService {

    private static final Logger log = LoggerFactory.getLogger(JournalService.class);

    private final JournalRepository journalRepository;
    private final Clock clock;

    public JournalService(JournalRepository journalRepository, Clock clock) {
        this.journalRepository = journalRepository;
        this.clock = clock;
    }

    /**
     * Saves a journal entry for a session and the decision made for it.
     */
    public JournalEntry record(AssessmentSession session, RiskDecision decision, String notes) {
        JournalEntry journalEntry = JournalEntry.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(decision.getTimestamp() != null ? decision.getTimestamp() : LocalDateTime.now(clock))
                .answers(session.getAnswers())
                .stats(session.getStats())
                .shouldTrade(decision.isShouldTrade())
                .riskPercent(decision.getRiskPercent())
                .finalScore(decision.getFinalScore())
                .categoryScores(decision.getCategoryScores())
                .hardStopsPassed(decision.getHardStopOutcome().isPassed())
                .tradeDetails(session.getTradeDetails())
                .lotSize(decision.getLotSize())
                .notes(notes != null ? notes.trim() : "")
                .build();

        journalRepository.save(journalEntry);
        log.info("Journal entry {} saved (trade={}, score={})", journalEntry.getId(), decision.isShouldTrade(),
                decision.getFinalScore());
        return journalEntry;
    }

    /**
     * Returns the most recent entries, oldest first.
     *
     * @param limit maximum number of entries; 0 or less returns all
     * @param tradedOnly only entries where trading was recommended
     */
    public List<JournalEntry> getEntries(int limit, boolean tradedOnly) {
        List<JournalEntry> entries = journalRepository.findAll().stream()
                .filter(entry -> !tradedOnly || entry.isShouldTrade())
                .collect(Collectors.toList());
        if (limit > 0 && entries.size() > limit) {
            return List.copyOf(entries.subList(entries.size() - limit, entries.size()));
        }
        return List.copyOf(entries);
    }

    /**
     * Days since the last session where trading was recommended, or empty if there was none.
     */
    public Optional<Long> daysSinceLastTrade() {
        List<JournalEntry> traded = getEntries(1, true);
        if (traded.isEmpty()) {
            return Optional.empty();
        }
        LocalDate lastTradeDate = traded.get(0).getTimestamp().toLocalDate();
        return Optional.of(ChronoUnit.DAYS.between(lastTradeDate, LocalDate.now(clock)));
    }

    /**
     * Aggregates the sessions of the last {@code days} days.
     */
    public JournalStats getStats(int days) {
        LocalDateTime since = LocalDateTime.now(clock).minusDays(days);
        List<JournalEntry> recent = journalRepository.findAll().stream()
                .filter(entry -> !entry.getTimestamp().isBefore(since))
                .collect(Collectors.toList());

        int total = recent.size();
        int traded = (int) recent.stream().filter(JournalEntry::isShouldTrade).count();
        double avgScore = recent.stream().mapToDouble(JournalEntry::getFinalScore).average().orElse(0);

        return JournalStats.builder()
                .days(days)
                .totalSessions(total)
                .tradesTaken(traded)
                .avgScore(round1(avgScore))
                .tradeRate(total > 0 ? round1(traded * 100.0 / total) : 0)
                .risk2PercentCount(countAtRisk(recent, 2.0))
                .risk3PercentCount(countAtRisk(recent, 3.0))
                .build();
    }

    private static int countAtRisk(List<JournalEntry> entries, double riskPercent) {
        return (int) entries.stream()
                .filter(entry -> entry.isShouldTrade() && entry.getRiskPercent() == riskPercent)
                .count();
    }

    private static double round1(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
