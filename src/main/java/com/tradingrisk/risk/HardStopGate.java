package com.tradingrisk.risk;

import com.tradingrisk.domain.model.TradingStats;
import com.tradingrisk.rules.HardStopThresholds;
import com.tradingrisk.rules.RuleConfig;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Gate that blocks trading outright when any non-negotiable condition holds.
 *
 * <p>Runs every enabled {@link HardStopRule} (all five unless {@code hard_stops.checks} picks a
 * subset) without short-circuiting, so the trader sees the complete list of reasons.
 *
 * <p>Stateless apart from the immutable rule set; safe to share between threads.
 */
@Component
public class HardStopGate {

    private static final Logger log = LoggerFactory.getLogger(HardStopGate.class);

    private final HardStopThresholds thresholds;
    private final List<HardStopRule> rules;

    public HardStopGate(RuleConfig ruleConfig) {
        this.thresholds = ruleConfig.getHardStops();
        List<String> enabled = thresholds.getEnabledChecks();
        this.rules = enabled == null || enabled.isEmpty()
                ? Arrays.asList(HardStopRule.values())
                : enabled.stream().map(HardStopRule::fromCode).distinct().collect(Collectors.toList());
    }

    /**
     * Evaluates all enabled checks against the answers and stats.
     *
     * @param answers raw answers keyed by question id (absent keys are treated permissively as 0/false)
     * @param stats running stats (null is treated as all zeros)
     * @return passed outcome, or failed outcome with one violation per triggered check
     */
    public HardStopOutcome evaluate(Map<String, Object> answers, TradingStats stats) {
        Map<String, Object> safeAnswers = answers != null ? answers : Map.of();
        TradingStats safeStats = stats != null ? stats : TradingStats.empty();

        List<HardStopViolation> violations = new ArrayList<>();
        for (HardStopRule rule : rules) {
            rule.check(safeAnswers, safeStats, thresholds).ifPresent(violations::add);
        }

        if (violations.isEmpty()) {
            return HardStopOutcome.passed();
        }
        log.warn("Hard stops triggered: {}", violations);
        return HardStopOutcome.failed(violations);
    }

    /** The checks this gate runs, in evaluation order. */
    public List<HardStopRule> getRules() {
        return List.copyOf(rules);
    }
}
