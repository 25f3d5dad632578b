package com.tradingrisk.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Optional trade parameters used for lot sizing: account balance, stop-loss distance in pips
 * and instrument symbol (e.g. EURUSD).
 */
@Value
@Builder
public class TradeDetails {

    BigDecimal balance;
    BigDecimal stopLossPips;
    String instrument;

    /** True when every field needed for lot sizing is present. */
    public boolean isComplete() {
        return balance != null && stopLossPips != null && instrument != null && !instrument.isBlank();
    }
}
