package org.nowstart.zonerisk.regime;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.zonerisk.data.property.ZoneRiskProperties;
import org.nowstart.zonerisk.data.type.TrendDirection;
import org.nowstart.zonerisk.indicator.IndicatorCalculator;
import org.nowstart.zonerisk.zone.core.OhlcvCandle;
import org.springframework.stereotype.Component;

/**
 * Derives {@link RegimeInputs} from 5-minute candles in ascending time order.
 */
@Component
@RequiredArgsConstructor
public class RegimeInputResolver {

    static final int CANDLES_PER_HOUR = 12;

    private final ZoneRiskProperties properties;
    private final IndicatorCalculator indicatorCalculator;

    public RegimeInputs resolve(List<OhlcvCandle> fiveMinuteCandles) {
        if (fiveMinuteCandles == null || fiveMinuteCandles.isEmpty()) {
            return RegimeInputs.flat();
        }
        return new RegimeInputs(
                priceChange1h(fiveMinuteCandles),
                volatility5m(fiveMinuteCandles.get(fiveMinuteCandles.size() - 1)),
                trend(fiveMinuteCandles)
        );
    }

    double priceChange1h(List<OhlcvCandle> candles) {
        int last = candles.size() - 1;
        if (last < CANDLES_PER_HOUR) {
            return 0.0;
        }
        double previous = candles.get(last - CANDLES_PER_HOUR).close();
        if (!(previous > 0.0)) {
            return 0.0;
        }
        return candles.get(last).close() / previous - 1.0;
    }

    double volatility5m(OhlcvCandle candle) {
        if (!(candle.close() > 0.0)) {
            return 0.0;
        }
        return candle.range() / candle.close();
    }

    TrendDirection trend(List<OhlcvCandle> candles) {
        double[] close = indicatorCalculator.closes(candles);
        double anchor = indicatorCalculator.last(
                indicatorCalculator.exponentialMovingAverage(close, properties.regime().trendEmaLength())
        );
        if (!Double.isFinite(anchor)) {
            return TrendDirection.NEUTRAL;
        }
        double band = properties.regime().trendBand().doubleValue();
        double latest = close[close.length - 1];
        if (latest > anchor * (1.0 + band)) {
            return TrendDirection.BULLISH;
        }
        if (latest < anchor * (1.0 - band)) {
            return TrendDirection.BEARISH;
        }
        return TrendDirection.NEUTRAL;
    }
}
