package org.nowstart.zonerisk.source;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.zonerisk.data.property.ZoneRiskProperties;
import org.nowstart.zonerisk.data.type.Timeframe;
import org.nowstart.zonerisk.zone.core.LevelBatch;
import org.nowstart.zonerisk.zone.core.OhlcvCandle;
import org.nowstart.zonerisk.zone.core.RawLevel;
import org.springframework.stereotype.Component;

/**
 * Classic floor-trader pivots projected from the last completed day and the last completed week.
 * The newest candle of each series is treated as still forming.
 */
@Component
@RequiredArgsConstructor
public class PivotPointLevelSource implements LevelSource {

    public static final String TAG = "pivot";
    static final int DAYS_PER_WEEK = 5;

    private final ZoneRiskProperties properties;

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public List<LevelBatch> collect(LevelSourceContext context) {
        List<LevelBatch> batches = new ArrayList<>();

        List<OhlcvCandle> daily = context.candles(Timeframe.D1);
        if (daily.size() >= 2) {
            OhlcvCandle previousDay = daily.get(daily.size() - 2);
            batches.add(new LevelBatch(
                    TAG,
                    Timeframe.D1,
                    project(previousDay.high(), previousDay.low(), previousDay.close(), "Daily",
                            properties.sources().dailyPivotWeight().doubleValue(), Timeframe.D1),
                    context.atr(Timeframe.D1)
            ));
        }

        OhlcvCandle previousWeek = previousWeek(context.candles(Timeframe.W1), daily);
        if (previousWeek != null) {
            batches.add(new LevelBatch(
                    TAG,
                    Timeframe.W1,
                    project(previousWeek.high(), previousWeek.low(), previousWeek.close(), "Weekly",
                            properties.sources().weeklyPivotWeight().doubleValue(), Timeframe.W1),
                    context.atr(Timeframe.W1)
            ));
        }
        return batches;
    }

    /**
     * PP, R1 to R3 and S1 to S3. Degenerate ranges produce nothing.
     */
    List<RawLevel> project(double high, double low, double close, String prefix, double weight, Timeframe timeframe) {
        if (!(high > low) || !Double.isFinite(close)) {
            return List.of();
        }
        double pivot = (high + low + close) / 3.0;
        double range = high - low;

        List<RawLevel> levels = new ArrayList<>();
        levels.add(new RawLevel(pivot, prefix + "_PP", weight, timeframe));
        levels.add(new RawLevel(2.0 * pivot - low, prefix + "_R1", weight, timeframe));
        levels.add(new RawLevel(2.0 * pivot - high, prefix + "_S1", weight, timeframe));
        levels.add(new RawLevel(pivot + range, prefix + "_R2", weight, timeframe));
        levels.add(new RawLevel(pivot - range, prefix + "_S2", weight, timeframe));
        levels.add(new RawLevel(high + 2.0 * (pivot - low), prefix + "_R3", weight, timeframe));
        levels.add(new RawLevel(low - 2.0 * (high - pivot), prefix + "_S3", weight, timeframe));
        return levels;
    }

    private OhlcvCandle previousWeek(List<OhlcvCandle> weekly, List<OhlcvCandle> daily) {
        if (weekly.size() >= 2) {
            return weekly.get(weekly.size() - 2);
        }
        if (daily.size() < DAYS_PER_WEEK + 1) {
            return null;
        }

        List<OhlcvCandle> week = daily.subList(daily.size() - 1 - DAYS_PER_WEEK, daily.size() - 1);
        double high = week.stream().mapToDouble(OhlcvCandle::high).max().orElse(Double.NaN);
        double low = week.stream().mapToDouble(OhlcvCandle::low).min().orElse(Double.NaN);
        OhlcvCandle first = week.get(0);
        OhlcvCandle last = week.get(week.size() - 1);
        double volume = week.stream().mapToDouble(OhlcvCandle::volume).sum();
        return new OhlcvCandle(last.timestamp(), first.open(), high, low, last.close(), volume);
    }
}
