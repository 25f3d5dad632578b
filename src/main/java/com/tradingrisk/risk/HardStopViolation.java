package com.tradingrisk.risk;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A single failed hard-stop check.
 *
 * <p>{@code code} is machine-readable (e.g. CONSECUTIVE_LOSSES), {@code message} is the line
 * shown to the trader.
 */
@Getter
@Builder
@EqualsAndHashCode
public class HardStopViolation {

    private final String code;
    private final String message;

    public static HardStopViolation of(String code, String message) {
        return HardStopViolation.builder().code(code).message(message).build();
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
