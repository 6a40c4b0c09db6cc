package org.nowstart.zonerisk.source;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.zonerisk.data.property.ZoneRiskProperties;
import org.nowstart.zonerisk.data.type.Timeframe;
import org.nowstart.zonerisk.indicator.IndicatorCalculator;
import org.nowstart.zonerisk.zone.core.LevelBatch;
import org.nowstart.zonerisk.zone.core.OhlcvCandle;
import org.nowstart.zonerisk.zone.core.RawLevel;
import org.springframework.stereotype.Component;

/**
 * SMA 50 and SMA 200 of every configured timeframe.
 */
@Component
@RequiredArgsConstructor
public class MovingAverageLevelSource implements LevelSource {

    public static final String TAG = "moving-average";
    static final int SHORT_PERIOD = 50;
    static final int LONG_PERIOD = 200;

    private final ZoneRiskProperties properties;
    private final IndicatorCalculator indicatorCalculator;

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public List<LevelBatch> collect(LevelSourceContext context) {
        double shortWeight = properties.sources().sma50Weight().doubleValue();
        double longWeight = properties.sources().sma200Weight().doubleValue();

        List<LevelBatch> batches = new ArrayList<>();
        for (Timeframe timeframe : properties.sources().timeframes()) {
            List<OhlcvCandle> candles = context.candles(timeframe);
            if (candles.isEmpty()) {
                continue;
            }
            double[] close = indicatorCalculator.closes(candles);
            List<RawLevel> levels = new ArrayList<>();
            addIfFinite(levels, indicatorCalculator.last(indicatorCalculator.simpleMovingAverage(close, SHORT_PERIOD)),
                    "SMA_50", shortWeight, timeframe);
            addIfFinite(levels, indicatorCalculator.last(indicatorCalculator.simpleMovingAverage(close, LONG_PERIOD)),
                    "SMA_200", longWeight, timeframe);
            batches.add(new LevelBatch(TAG, timeframe, levels, context.atr(timeframe)));
        }
        return batches;
    }

    private void addIfFinite(List<RawLevel> levels, double price, String name, double weight, Timeframe timeframe) {
        if (Double.isFinite(price)) {
            levels.add(new RawLevel(price, name, weight, timeframe));
        }
    }
}
