package com.tradingrisk.api.dto.request;

import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Optional trade parameters for lot sizing. Lot size is only computed when all three are present.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeDetailsRequest {

    @Positive
    private BigDecimal balance;

    @Positive
    private BigDecimal stopLossPips;

    private String instrument;
}
