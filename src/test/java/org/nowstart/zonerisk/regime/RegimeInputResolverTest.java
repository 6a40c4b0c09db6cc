package org.nowstart.zonerisk.regime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.zonerisk.ZoneRiskPropertiesFixture;
import org.nowstart.zonerisk.data.type.TrendDirection;
import org.nowstart.zonerisk.indicator.IndicatorCalculator;
import org.nowstart.zonerisk.zone.core.OhlcvCandle;

class RegimeInputResolverTest {

    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");

    private final RegimeInputResolver resolver =
            new RegimeInputResolver(ZoneRiskPropertiesFixture.defaults(), new IndicatorCalculator());

    @Test
    void resolve_returnsFlatInputsWithoutCandles() {
        assertThat(resolver.resolve(List.of())).isEqualTo(RegimeInputs.flat());
        assertThat(resolver.resolve(null)).isEqualTo(RegimeInputs.flat());
    }

    @Test
    void resolve_measuresHourlyChangeVolatilityAndTrend() {
        List<OhlcvCandle> candles = flatCandles(119);
        candles.add(new OhlcvCandle(START.plusSeconds(119 * 300L), 100.0, 105.0, 103.0, 104.0, 1.0));

        RegimeInputs inputs = resolver.resolve(candles);

        assertThat(inputs.priceChange1h()).isCloseTo(0.04, within(1e-9));
        assertThat(inputs.volatility5m()).isCloseTo(2.0 / 104.0, within(1e-9));
        assertThat(inputs.trend()).isEqualTo(TrendDirection.BULLISH);
    }

    @Test
    void resolve_reportsBearishTrendBelowBand() {
        List<OhlcvCandle> candles = flatCandles(119);
        candles.add(new OhlcvCandle(START.plusSeconds(119 * 300L), 100.0, 100.0, 95.0, 96.0, 1.0));

        assertThat(resolver.resolve(candles).trend()).isEqualTo(TrendDirection.BEARISH);
    }

    @Test
    void resolve_isNeutralWithinBandOrWithoutEnoughHistory() {
        assertThat(resolver.resolve(flatCandles(120)).trend()).isEqualTo(TrendDirection.NEUTRAL);
        assertThat(resolver.resolve(flatCandles(10)).trend()).isEqualTo(TrendDirection.NEUTRAL);
    }

    @Test
    void priceChange1h_isZeroWithLessThanAnHour() {
        assertThat(resolver.priceChange1h(flatCandles(12))).isZero();
    }

    private List<OhlcvCandle> flatCandles(int count) {
        List<OhlcvCandle> candles = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            candles.add(new OhlcvCandle(START.plusSeconds(i * 300L), 100.0, 100.5, 99.5, 100.0, 1.0));
        }
        return candles;
    }
}
