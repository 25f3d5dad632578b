package com.tradingrisk.mapper;

import com.tradingrisk.api.dto.request.EvaluationRequest;
import com.tradingrisk.api.dto.request.StatsRequest;
import com.tradingrisk.api.dto.request.TradeDetailsRequest;
import com.tradingrisk.domain.model.AssessmentSession;
import com.tradingrisk.domain.model.TradeDetails;
import com.tradingrisk.domain.model.TradingStats;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper from assessment request DTOs to domain values.
 *
 * <p>Unset stats fields stay 0; an absent stats block maps to {@link TradingStats#empty()}.
 */
@Mapper
public interface AssessmentDtoMapper {

    TradingStats toStats(StatsRequest request);

    TradeDetails toTradeDetails(TradeDetailsRequest request);

    default AssessmentSession toSession(EvaluationRequest request) {
        return AssessmentSession.builder()
                .answers(request.getAnswers())
                .stats(request.getStats() != null ? toStats(request.getStats()) : TradingStats.empty())
                .tradeDetails(toTradeDetails(request.getTradeDetails()))
                .build();
    }
}
