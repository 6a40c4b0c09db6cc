package org.nowstart.zonerisk.source;

import java.util.List;
import java.util.Map;
import org.nowstart.zonerisk.data.type.Timeframe;
import org.nowstart.zonerisk.zone.core.OhlcvCandle;

/**
 * Market data shared by all sources in one cycle. Candle lists are in ascending time order.
 */
public record LevelSourceContext(
        String symbol,
        double currentPrice,
        Map<Timeframe, List<OhlcvCandle>> candles,
        Map<Timeframe, Double> atr
) {

    public LevelSourceContext {
        candles = candles == null ? Map.of() : Map.copyOf(candles);
        atr = atr == null ? Map.of() : Map.copyOf(atr);
    }

    public List<OhlcvCandle> candles(Timeframe timeframe) {
        return candles.getOrDefault(timeframe, List.of());
    }

    public double atr(Timeframe timeframe) {
        Double value = atr.get(timeframe);
        return value == null ? Double.NaN : value;
    }
}
