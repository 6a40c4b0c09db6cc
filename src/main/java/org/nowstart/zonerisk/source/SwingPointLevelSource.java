package org.nowstart.zonerisk.source;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.zonerisk.data.property.ZoneRiskProperties;
import org.nowstart.zonerisk.data.type.Timeframe;
import org.nowstart.zonerisk.data.type.ZoneTier;
import org.nowstart.zonerisk.zone.core.LevelBatch;
import org.nowstart.zonerisk.zone.core.OhlcvCandle;
import org.nowstart.zonerisk.zone.core.RawLevel;
import org.springframework.stereotype.Component;

/**
 * Fractal swing highs and lows. A bar is a swing high when its high is at least every high in the
 * surrounding window (lows mirrored). Weight falls off with age and rises with the bar's volume rank.
 */
@Component
@RequiredArgsConstructor
public class SwingPointLevelSource implements LevelSource {

    public static final String TAG = "swing";

    private final ZoneRiskProperties properties;

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public List<LevelBatch> collect(LevelSourceContext context) {
        List<LevelBatch> batches = new ArrayList<>();
        for (Timeframe timeframe : properties.sources().timeframes()) {
            List<OhlcvCandle> candles = context.candles(timeframe);
            List<RawLevel> levels = detect(candles, timeframe);
            if (!levels.isEmpty()) {
                batches.add(new LevelBatch(TAG, timeframe, levels, context.atr(timeframe)));
            }
        }
        return batches;
    }

    List<RawLevel> detect(List<OhlcvCandle> candles, Timeframe timeframe) {
        ZoneRiskProperties.Sources sources = properties.sources();
        int left = sources.swingLeftBars();
        int right = sources.swingRightBars();
        int maxAge = sources.swingMaxAge();

        List<OhlcvCandle> bars = candles.size() > maxAge
                ? candles.subList(candles.size() - maxAge, candles.size())
                : candles;
        int n = bars.size();
        if (n < left + right + 1) {
            return List.of();
        }

        double[] volumes = bars.stream().mapToDouble(OhlcvCandle::volume).toArray();
        double baseWeight = baseWeight(timeframe.tier());
        List<RawLevel> levels = new ArrayList<>();
        for (int i = left; i < n - right; i++) {
            OhlcvCandle bar = bars.get(i);
            boolean swingHigh = true;
            boolean swingLow = true;
            for (int j = i - left; j <= i + right && (swingHigh || swingLow); j++) {
                if (j == i) {
                    continue;
                }
                OhlcvCandle other = bars.get(j);
                if (other.high() > bar.high()) {
                    swingHigh = false;
                }
                if (other.low() < bar.low()) {
                    swingLow = false;
                }
            }
            if (!swingHigh && !swingLow) {
                continue;
            }

            int barsAgo = n - 1 - i;
            double weight = baseWeight * ageFactor(barsAgo, maxAge) * volumeFactor(bar.volume(), volumes);
            if (swingHigh) {
                levels.add(new RawLevel(bar.high(), "Swing_High", weight, timeframe));
            }
            if (swingLow) {
                levels.add(new RawLevel(bar.low(), "Swing_Low", weight, timeframe));
            }
        }
        return levels;
    }

    double baseWeight(ZoneTier tier) {
        return switch (tier) {
            case MAJOR -> 2.0;
            case INTERMEDIATE -> 1.5;
            case MINOR -> 0.8;
        };
    }

    double ageFactor(int barsAgo, int maxAge) {
        return Math.max(0.5, 1.0 - ((double) barsAgo / maxAge) * 0.5);
    }

    /**
     * Percentile rank of the bar's volume: top 30% counts fully, bottom 30% at 0.3, linear between.
     */
    double volumeFactor(double barVolume, double[] volumes) {
        if (volumes.length == 0 || !(barVolume > 0.0)) {
            return 0.5;
        }
        long atOrBelow = 0;
        for (double volume : volumes) {
            if (volume <= barVolume) {
                atOrBelow++;
            }
        }
        double rank = (double) atOrBelow / volumes.length;
        if (rank >= 0.7) {
            return 1.0;
        }
        if (rank >= 0.3) {
            return 0.5 + (rank - 0.3) * 1.25;
        }
        return 0.3;
    }
}
