package com.tradingrisk.api.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Running stats in an assessment request. Omitted fields count as 0.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StatsRequest {

    @Min(0)
    private Integer consecutiveLosses;

    @DecimalMin("0")
    @DecimalMax("100")
    private Double dailyLossPercent;
}
