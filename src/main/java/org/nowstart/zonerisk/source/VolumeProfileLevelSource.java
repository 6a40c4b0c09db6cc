package org.nowstart.zonerisk.source;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.zonerisk.data.property.ZoneRiskProperties;
import org.nowstart.zonerisk.data.type.Timeframe;
import org.nowstart.zonerisk.zone.core.LevelBatch;
import org.nowstart.zonerisk.zone.core.OhlcvCandle;
import org.nowstart.zonerisk.zone.core.RawLevel;
import org.springframework.stereotype.Component;

/**
 * Volume profile of the last 24 hours of 15 minute bars. Each bar's volume is spread evenly over its
 * high-low range and binned by price. Emits the point of control (VPOC) and the edges of the value
 * area holding the configured share of volume: VAH above the current price, VAL below it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VolumeProfileLevelSource implements LevelSource {

    public static final String TAG = "volume-profile";

    static final Timeframe PROFILE_TIMEFRAME = Timeframe.M15;
    // profile levels rank with intermediate structure
    static final Timeframe LEVEL_TIMEFRAME = Timeframe.H1;
    static final int MIN_BARS = 10;
    static final int MIN_BINS = 30;
    static final int MAX_BINS = 80;
    static final double BIN_WIDTH_PCT = 0.001;

    private final ZoneRiskProperties properties;

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public List<LevelBatch> collect(LevelSourceContext context) {
        List<OhlcvCandle> candles = context.candles(PROFILE_TIMEFRAME);
        int lookback = properties.sources().volumeProfileBars();
        List<OhlcvCandle> bars = candles.size() > lookback
                ? candles.subList(candles.size() - lookback, candles.size())
                : candles;

        double currentPrice = context.currentPrice();
        if (!(currentPrice > 0.0) && !bars.isEmpty()) {
            currentPrice = bars.get(bars.size() - 1).close();
        }
        Profile profile = build(bars, currentPrice);
        if (profile == null) {
            log.debug("Volume profile skipped. symbol={}, bars={}", context.symbol(), bars.size());
            return List.of();
        }
        return List.of(new LevelBatch(TAG, LEVEL_TIMEFRAME, levels(profile, currentPrice), context.atr(LEVEL_TIMEFRAME)));
    }

    Profile build(List<OhlcvCandle> bars, double referencePrice) {
        if (bars.size() < MIN_BARS || !(referencePrice > 0.0)) {
            return null;
        }
        double low = bars.stream().mapToDouble(OhlcvCandle::low).filter(price -> price > 0.0).min().orElse(Double.NaN);
        double high = bars.stream().mapToDouble(OhlcvCandle::high).filter(price -> price > 0.0).max().orElse(Double.NaN);
        double range = high - low;
        if (!(range > 0.0)) {
            return null;
        }

        int binCount = Math.max(MIN_BINS, Math.min(MAX_BINS, (int) (range / (referencePrice * BIN_WIDTH_PCT))));
        double binSize = range / binCount;
        double[] volumes = new double[binCount];
        for (OhlcvCandle bar : bars) {
            if (!(bar.high() > 0.0 && bar.low() > 0.0 && bar.volume() > 0.0)) {
                continue;
            }
            double barRange = bar.range();
            if (!(barRange > 0.0)) {
                int bin = Math.min(binCount - 1, (int) ((bar.low() - low) / binSize));
                volumes[bin] += bar.volume();
                continue;
            }
            for (int i = 0; i < binCount; i++) {
                double binLow = low + i * binSize;
                double overlap = Math.min(bar.high(), binLow + binSize) - Math.max(bar.low(), binLow);
                if (overlap > 0.0) {
                    volumes[i] += bar.volume() * overlap / barRange;
                }
            }
        }

        double total = 0.0;
        for (double volume : volumes) {
            total += volume;
        }
        if (!(total > 0.0)) {
            return null;
        }
        return new Profile(low, binSize, volumes, total);
    }

    List<RawLevel> levels(Profile profile, double currentPrice) {
        ZoneRiskProperties.Sources sources = properties.sources();
        double valueAreaWeight = sources.valueAreaWeight().doubleValue();
        List<RawLevel> levels = new ArrayList<>();
        levels.add(new RawLevel(profile.pointOfControl(), "VP_VPOC", sources.vpocWeight().doubleValue(), LEVEL_TIMEFRAME));

        ValueArea valueArea = profile.valueArea(sources.valueAreaPct().doubleValue());
        if (valueArea.high() > currentPrice) {
            levels.add(new RawLevel(valueArea.high(), "VP_VAH", valueAreaWeight, LEVEL_TIMEFRAME));
        }
        if (valueArea.low() < currentPrice) {
            levels.add(new RawLevel(valueArea.low(), "VP_VAL", valueAreaWeight, LEVEL_TIMEFRAME));
        }
        return levels;
    }

    record Profile(double low, double binSize, double[] volumes, double totalVolume) {

        double binLow(int index) {
            return low + index * binSize;
        }

        double pointOfControl() {
            int peak = 0;
            for (int i = 1; i < volumes.length; i++) {
                if (volumes[i] > volumes[peak]) {
                    peak = i;
                }
            }
            return binLow(peak) + binSize / 2.0;
        }

        /**
         * Bins taken in descending volume order until their volume reaches {@code share} of the total.
         */
        ValueArea valueArea(double share) {
            List<Integer> byVolume = IntStream.range(0, volumes.length)
                    .boxed()
                    .sorted(Comparator.comparingDouble((Integer index) -> volumes[index]).reversed())
                    .toList();
            double target = totalVolume * share;
            double accumulated = 0.0;
            int lowest = Integer.MAX_VALUE;
            int highest = Integer.MIN_VALUE;
            for (int index : byVolume) {
                accumulated += volumes[index];
                lowest = Math.min(lowest, index);
                highest = Math.max(highest, index);
                if (accumulated >= target) {
                    break;
                }
            }
            return new ValueArea(binLow(lowest), binLow(highest + 1));
        }
    }

    record ValueArea(double low, double high) {
    }
}
