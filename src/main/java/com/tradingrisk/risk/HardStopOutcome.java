package com.tradingrisk.risk;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Result of the hard-stop gate.
 *
 * <p>Either passed (no violations, no reason) or failed (one or more violations and a reason
 * joining all of them). Every triggered check is reported, not just the first.
 */
@Getter
@EqualsAndHashCode
public class HardStopOutcome {

    static final String REASON_PREFIX = "Hard stops failed: ";
    static final String SEPARATOR = "; ";

    private final boolean passed;
    private final List<HardStopViolation> violations;
    private final String reason;

    private HardStopOutcome(boolean passed, List<HardStopViolation> violations, String reason) {
        this.passed = passed;
        this.violations = violations;
        this.reason = reason;
    }

    public static HardStopOutcome passed() {
        return new HardStopOutcome(true, Collections.emptyList(), null);
    }

    public static HardStopOutcome failed(List<HardStopViolation> violations) {
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("A failed hard-stop outcome needs at least one violation");
        }
        List<HardStopViolation> copy = List.copyOf(violations);
        String reason = REASON_PREFIX
                + copy.stream().map(HardStopViolation::getMessage).collect(Collectors.joining(SEPARATOR));
        return new HardStopOutcome(false, copy, reason);
    }

    /** Human-readable failure lines, in check order. */
    public List<String> getFailedChecks() {
        return violations.stream().map(HardStopViolation::getMessage).collect(Collectors.toList());
    }

    @JsonIgnore
    public boolean isFailed() {
        return !passed;
    }
}
