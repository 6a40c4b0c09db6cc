package org.nowstart.zonerisk.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.zonerisk.ZoneRiskPropertiesFixture;
import org.nowstart.zonerisk.data.dto.UpbitOrderbookResponse;
import org.nowstart.zonerisk.data.exception.MissingDataException;
import org.nowstart.zonerisk.data.type.Timeframe;
import org.nowstart.zonerisk.service.MarketDataService;
import org.nowstart.zonerisk.zone.core.LevelBatch;
import org.nowstart.zonerisk.zone.core.RawLevel;

@ExtendWith(MockitoExtension.class)
class OrderBookWallLevelSourceTest {

    @Mock
    private MarketDataService marketDataService;

    @Test
    void findWalls_detectsOversizedBidsBelowAndAsksAbovePrice() {
        OrderBookWallLevelSource source = newSource();

        List<RawLevel> walls = source.findWalls(units(), 100.0, Timeframe.M15);

        assertThat(walls).extracting(RawLevel::sourceTag).containsExactlyInAnyOrder("Bid_Wall", "Ask_Wall");
        assertThat(walls).extracting(RawLevel::price).containsExactlyInAnyOrder(95.0, 103.0);
        assertThat(walls).allSatisfy(wall -> {
            assertThat(wall.sourceWeight()).isEqualTo(2.0);
            assertThat(wall.timeframe()).isEqualTo(Timeframe.M15);
        });
    }

    @Test
    void findWalls_ignoresWallsOnWrongSideOfPrice() {
        OrderBookWallLevelSource source = newSource();

        List<RawLevel> walls = source.findWalls(units(), 94.0, Timeframe.M15);

        assertThat(walls).extracting(RawLevel::sourceTag).containsExactly("Ask_Wall");
    }

    @Test
    void collect_wrapsWallsInSingleBatch() {
        when(marketDataService.fetchOrderbook("KRW-BTC"))
                .thenReturn(new UpbitOrderbookResponse("KRW-BTC", 1L, BigDecimal.ONE, BigDecimal.ONE, units()));
        LevelSourceContext context = new LevelSourceContext("KRW-BTC", 100.0, Map.of(), Map.of(Timeframe.M15, 1.5));

        List<LevelBatch> batches = newSource().collect(context);

        assertThat(batches).hasSize(1);
        assertThat(batches.get(0).sourceTag()).isEqualTo(OrderBookWallLevelSource.TAG);
        assertThat(batches.get(0).atr()).isEqualTo(1.5);
        assertThat(batches.get(0).levels()).hasSize(2);
    }

    @Test
    void collect_throwsMissingDataForEmptyBook() {
        when(marketDataService.fetchOrderbook("KRW-BTC"))
                .thenReturn(new UpbitOrderbookResponse("KRW-BTC", 1L, BigDecimal.ZERO, BigDecimal.ZERO, List.of()));
        LevelSourceContext context = new LevelSourceContext("KRW-BTC", 100.0, Map.of(), Map.of());

        assertThatThrownBy(() -> newSource().collect(context))
                .isInstanceOf(MissingDataException.class)
                .hasMessageContaining("KRW-BTC");
    }

    private OrderBookWallLevelSource newSource() {
        return new OrderBookWallLevelSource(ZoneRiskPropertiesFixture.defaults(), marketDataService);
    }

    private List<UpbitOrderbookResponse.Unit> units() {
        return List.of(
                unit(101, 99, 1, 1),
                unit(102, 98, 1, 1),
                unit(103, 97, 12, 1),
                unit(104, 96, 1, 1),
                unit(105, 95, 1, 10)
        );
    }

    private UpbitOrderbookResponse.Unit unit(double askPrice, double bidPrice, double askSize, double bidSize) {
        return new UpbitOrderbookResponse.Unit(
                BigDecimal.valueOf(askPrice),
                BigDecimal.valueOf(bidPrice),
                BigDecimal.valueOf(askSize),
                BigDecimal.valueOf(bidSize)
        );
    }
}
