package org.nowstart.zonerisk.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.zonerisk.ZoneRiskPropertiesFixture;
import org.nowstart.zonerisk.data.type.Timeframe;
import org.nowstart.zonerisk.indicator.IndicatorCalculator;
import org.nowstart.zonerisk.zone.core.LevelBatch;
import org.nowstart.zonerisk.zone.core.OhlcvCandle;
import org.nowstart.zonerisk.zone.core.RawLevel;

class IndicatorLevelSourceTest {

    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");

    private final IndicatorCalculator indicatorCalculator = new IndicatorCalculator();

    @Test
    void movingAverage_emitsBothAveragesWhenHistoryAllows() {
        MovingAverageLevelSource source =
                new MovingAverageLevelSource(ZoneRiskPropertiesFixture.defaults(), indicatorCalculator);
        LevelSourceContext context = new LevelSourceContext(
                "KRW-BTC",
                100.0,
                Map.of(Timeframe.H1, constant(200, 100.0), Timeframe.D1, constant(60, 50.0)),
                Map.of(Timeframe.H1, 2.0)
        );

        List<LevelBatch> batches = source.collect(context);

        assertThat(batches).hasSize(2);
        LevelBatch hourly = batches.stream().filter(batch -> batch.timeframe() == Timeframe.H1).findFirst().orElseThrow();
        assertThat(hourly.levels()).extracting(RawLevel::sourceTag).containsExactly("SMA_50", "SMA_200");
        assertThat(hourly.levels()).extracting(RawLevel::sourceWeight).containsExactly(0.8, 1.5);
        assertThat(hourly.levels().get(1).price()).isCloseTo(100.0, within(1e-9));
        assertThat(hourly.atr()).isEqualTo(2.0);

        LevelBatch daily = batches.stream().filter(batch -> batch.timeframe() == Timeframe.D1).findFirst().orElseThrow();
        assertThat(daily.levels()).extracting(RawLevel::sourceTag).containsExactly("SMA_50");
    }

    @Test
    void bollinger_placesBandsTwoDeviationsFromMean() {
        BollingerBandLevelSource source =
                new BollingerBandLevelSource(ZoneRiskPropertiesFixture.defaults(), indicatorCalculator);
        List<OhlcvCandle> candles = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            double close = i % 2 == 0 ? 99.0 : 101.0;
            candles.add(new OhlcvCandle(START.plusSeconds(i * 900L), close, close + 0.5, close - 0.5, close, 1.0));
        }
        LevelSourceContext context = new LevelSourceContext(
                "KRW-BTC",
                100.0,
                Map.of(Timeframe.M15, candles, Timeframe.H4, constant(5, 100.0)),
                Map.of()
        );

        List<LevelBatch> batches = source.collect(context);

        assertThat(batches).hasSize(1);
        assertThat(batches.get(0).levels()).extracting(RawLevel::sourceTag).containsExactly("BB_Upper", "BB_Lower");
        assertThat(batches.get(0).levels().get(0).price()).isCloseTo(102.0, within(1e-9));
        assertThat(batches.get(0).levels().get(1).price()).isCloseTo(98.0, within(1e-9));
    }

    private List<OhlcvCandle> constant(int count, double close) {
        List<OhlcvCandle> candles = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            candles.add(new OhlcvCandle(START.plusSeconds(i * 3600L), close, close + 1.0, close - 1.0, close, 1.0));
        }
        return candles;
    }
}
