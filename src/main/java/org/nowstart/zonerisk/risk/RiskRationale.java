package org.nowstart.zonerisk.risk;

import java.util.Locale;
import org.nowstart.zonerisk.data.type.MarketCondition;

/**
 * Why a set of risk parameters looks the way it does.
 */
public record RiskRationale(
        MarketCondition condition,
        boolean trendAligned,
        boolean counterTrend,
        Long takeProfitZoneId,
        Long stopLossZoneId,
        double takeProfitMultiplier,
        double stopLossMultiplier,
        double positionMultiplier,
        boolean takeProfitClamped,
        boolean stopLossClamped,
        boolean positionClamped
) {

    public String describe() {
        String alignment = trendAligned ? "trend-aligned" : counterTrend ? "counter-trend" : "neutral";
        return String.format(
                Locale.ROOT,
                "regime=%s (%s) tpZone=%s slZone=%s tpMult=%.2f slMult=%.2f position=%.2f clamps[tp=%s sl=%s position=%s]",
                condition,
                alignment,
                takeProfitZoneId == null ? "fallback" : "#" + takeProfitZoneId,
                stopLossZoneId == null ? "fallback" : "#" + stopLossZoneId,
                takeProfitMultiplier,
                stopLossMultiplier,
                positionMultiplier,
                takeProfitClamped,
                stopLossClamped,
                positionClamped
        );
    }
}
