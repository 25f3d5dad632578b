package com.tradingrisk.risk;

import com.tradingrisk.domain.model.TradeDetails;
import com.tradingrisk.exception.ValidationException;
import com.tradingrisk.rules.LotSizingRules;
import com.tradingrisk.rules.RuleConfig;
import com.tradingrisk.rules.ScoreThresholds;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps a final score to a {@link RiskTier} and sizes the position for a chosen tier.
 *
 * <p>Tiers (cutoffs from {@code scoring.thresholds}):
 * <ul>
 *   <li>score &lt; no_trade: no trade, 0%</li>
 *   <li>no_trade &lt;= score &lt; risk_2_percent: trade at 2%</li>
 *   <li>score &gt;= risk_2_percent: trade at 3%</li>
 * </ul>
 *
 * <p>Lot size formula: (balance * riskPercent / 100) / (stopLossPips * pipValue), clamped to
 * [min_lot_size, max_lot_size] and rounded half-up to 2 decimals. With a 10,000 balance, 3% risk,
 * a 20 pip stop and a pip value of 10, the result is 300 / 200 = 1.5 lots.
 */
@Component
public class RiskDecider {

    private static final Logger log = LoggerFactory.getLogger(RiskDecider.class);

    private static final int LOT_SCALE = 2;
    private static final int INTERMEDIATE_SCALE = 10;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ScoreThresholds scoreThresholds;
    private final LotSizingRules lotSizingRules;

    public RiskDecider(RuleConfig ruleConfig) {
        this.scoreThresholds = ruleConfig.getScoreThresholds();
        this.lotSizingRules = ruleConfig.getLotSizing();
    }

    /**
     * Selects the risk tier for a final score. A non-finite score never allows trading.
     */
    public RiskTier decide(double finalScore) {
        if (!Double.isFinite(finalScore) || finalScore < scoreThresholds.getNoTrade()) {
            return RiskTier.NO_TRADE;
        }
        if (finalScore < scoreThresholds.getRisk2Percent()) {
            return RiskTier.STANDARD;
        }
        return RiskTier.ELEVATED;
    }

    /**
     * Calculates the lot size for the given risk percentage and trade details.
     *
     * @param riskPercent percentage of balance to risk (e.g. 2.0)
     * @param tradeDetails balance, stop loss in pips and instrument; balance and stop loss must be positive
     * @return lot size clamped to the configured range, 2 decimals
     * @throws ValidationException if the balance or stop loss is missing or not positive
     */
    public BigDecimal lotSize(double riskPercent, TradeDetails tradeDetails) {
        BigDecimal balance = tradeDetails.getBalance();
        BigDecimal stopLossPips = tradeDetails.getStopLossPips();
        if (balance == null || balance.signum() <= 0) {
            throw new ValidationException("Balance must be positive", Map.of("balance", String.valueOf(balance)));
        }
        if (stopLossPips == null || stopLossPips.signum() <= 0) {
            throw new ValidationException(
                    "Stop loss must be a positive number of pips", Map.of("stopLossPips", String.valueOf(stopLossPips)));
        }

        BigDecimal pipValue = lotSizingRules.pipValue(tradeDetails.getInstrument());
        BigDecimal riskAmount = balance.multiply(BigDecimal.valueOf(riskPercent)).divide(HUNDRED);
        BigDecimal rawLots =
                riskAmount.divide(stopLossPips.multiply(pipValue), INTERMEDIATE_SCALE, RoundingMode.HALF_UP);

        BigDecimal clamped = rawLots.max(lotSizingRules.getMinLotSize()).min(lotSizingRules.getMaxLotSize());
        BigDecimal lots = clamped.setScale(LOT_SCALE, RoundingMode.HALF_UP);

        log.debug(
                "Lot sizing: {}% of {} = {} at risk, {} pips x {} per pip = {} lots (raw {})",
                riskPercent, balance, riskAmount, stopLossPips, pipValue, lots, rawLots);
        return lots;
    }
}
