package org.nowstart.zonerisk.source;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.zonerisk.data.dto.UpbitOrderbookResponse;
import org.nowstart.zonerisk.data.exception.MissingDataException;
import org.nowstart.zonerisk.data.property.ZoneRiskProperties;
import org.nowstart.zonerisk.data.type.Timeframe;
import org.nowstart.zonerisk.service.MarketDataService;
import org.nowstart.zonerisk.zone.core.LevelBatch;
import org.nowstart.zonerisk.zone.core.RawLevel;
import org.springframework.stereotype.Component;

/**
 * Resting orders far larger than the book average. Bid walls below the current price act as support
 * and ask walls above it as resistance.
 */
@Component
@RequiredArgsConstructor
public class OrderBookWallLevelSource implements LevelSource {

    public static final String TAG = "order-book";

    private final ZoneRiskProperties properties;
    private final MarketDataService marketDataService;

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public List<LevelBatch> collect(LevelSourceContext context) {
        UpbitOrderbookResponse orderbook = marketDataService.fetchOrderbook(context.symbol());
        if (orderbook == null || orderbook.orderbook_units() == null || orderbook.orderbook_units().isEmpty()) {
            throw new MissingDataException(TAG, "Orderbook is empty for market=" + context.symbol());
        }
        Timeframe timeframe = properties.sources().orderBookTimeframe();
        return List.of(new LevelBatch(
                TAG,
                timeframe,
                findWalls(orderbook.orderbook_units(), context.currentPrice(), timeframe),
                context.atr(timeframe)
        ));
    }

    List<RawLevel> findWalls(List<UpbitOrderbookResponse.Unit> units, double currentPrice, Timeframe timeframe) {
        double multiple = properties.sources().orderWallMultiple().doubleValue();
        double weight = properties.sources().orderWallWeight().doubleValue();
        double averageBid = units.stream().mapToDouble(unit -> toDouble(unit.bid_size())).average().orElse(0.0);
        double averageAsk = units.stream().mapToDouble(unit -> toDouble(unit.ask_size())).average().orElse(0.0);
        boolean knownPrice = Double.isFinite(currentPrice) && currentPrice > 0.0;

        List<RawLevel> walls = new ArrayList<>();
        for (UpbitOrderbookResponse.Unit unit : units) {
            double bidPrice = toDouble(unit.bid_price());
            if (averageBid > 0.0
                    && toDouble(unit.bid_size()) >= averageBid * multiple
                    && (!knownPrice || bidPrice < currentPrice)) {
                walls.add(new RawLevel(bidPrice, "Bid_Wall", weight, timeframe));
            }
            double askPrice = toDouble(unit.ask_price());
            if (averageAsk > 0.0
                    && toDouble(unit.ask_size()) >= averageAsk * multiple
                    && (!knownPrice || askPrice > currentPrice)) {
                walls.add(new RawLevel(askPrice, "Ask_Wall", weight, timeframe));
            }
        }
        return walls;
    }

    private double toDouble(BigDecimal value) {
        return value == null ? 0.0 : value.doubleValue();
    }
}
