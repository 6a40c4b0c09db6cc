package org.nowstart.zonerisk.regime;

import lombok.RequiredArgsConstructor;
import org.nowstart.zonerisk.data.property.ZoneRiskProperties;
import org.nowstart.zonerisk.data.type.MarketCondition;
import org.nowstart.zonerisk.data.type.TrendDirection;
import org.springframework.stereotype.Component;

/**
 * Stateless classification of the current market. The same inputs always give the same condition.
 */
@Component
@RequiredArgsConstructor
public class MarketRegimeClassifier {

    private final ZoneRiskProperties properties;

    public MarketCondition classify(RegimeInputs inputs) {
        return classify(inputs.priceChange1h(), inputs.volatility5m(), inputs.trend());
    }

    public MarketCondition classify(double priceChange1h, double volatility5m, TrendDirection trend) {
        double changeThreshold = properties.regime().extremeChangeThreshold().doubleValue();
        double volatilityThreshold = properties.regime().extremeVolatilityThreshold().doubleValue();
        double change = Double.isFinite(priceChange1h) ? priceChange1h : 0.0;
        double volatility = Double.isFinite(volatility5m) ? volatility5m : 0.0;

        boolean extreme = Math.abs(change) > changeThreshold || volatility > volatilityThreshold;
        if (!extreme) {
            return MarketCondition.NORMAL;
        }
        if (change > changeThreshold && trend == TrendDirection.BULLISH) {
            return MarketCondition.EXTREME_BULLISH;
        }
        if (change < -changeThreshold && trend == TrendDirection.BEARISH) {
            return MarketCondition.EXTREME_BEARISH;
        }
        return MarketCondition.EXTREME_VOLATILE;
    }
}
