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

@Component
@RequiredArgsConstructor
public class BollingerBandLevelSource implements LevelSource {

    public static final String TAG = "bollinger";

    private final ZoneRiskProperties properties;
    private final IndicatorCalculator indicatorCalculator;

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public List<LevelBatch> collect(LevelSourceContext context) {
        ZoneRiskProperties.Sources sources = properties.sources();
        int period = sources.bollingerPeriod();
        double width = sources.bollingerStdDev().doubleValue();
        double weight = sources.bollingerWeight().doubleValue();

        List<LevelBatch> batches = new ArrayList<>();
        for (Timeframe timeframe : sources.timeframes()) {
            List<OhlcvCandle> candles = context.candles(timeframe);
            if (candles.size() < period) {
                continue;
            }
            double[] close = indicatorCalculator.closes(candles);
            double middle = indicatorCalculator.last(indicatorCalculator.simpleMovingAverage(close, period));
            double deviation = indicatorCalculator.last(indicatorCalculator.rollingStandardDeviation(close, period));
            if (!Double.isFinite(middle) || !Double.isFinite(deviation)) {
                continue;
            }
            List<RawLevel> levels = new ArrayList<>();
            levels.add(new RawLevel(middle + width * deviation, "BB_Upper", weight, timeframe));
            levels.add(new RawLevel(middle - width * deviation, "BB_Lower", weight, timeframe));
            batches.add(new LevelBatch(TAG, timeframe, levels, context.atr(timeframe)));
        }
        return batches;
    }
}
