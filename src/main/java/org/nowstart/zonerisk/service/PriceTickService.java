package org.nowstart.zonerisk.service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.zonerisk.data.property.ZoneRiskProperties;
import org.nowstart.zonerisk.data.type.Timeframe;
import org.nowstart.zonerisk.zone.core.OhlcvCandle;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class PriceTickService {

    static final int POLL_CANDLE_COUNT = 10;

    private final ZoneRiskProperties properties;
    private final MarketDataService marketDataService;
    private final ZoneStateService zoneStateService;
    private final Map<String, Instant> lastDelivered = new ConcurrentHashMap<>();

    /**
     * Polls recent candles of every market and hands each newly completed one to the zone state writer
     * without waiting. The candle still forming is never delivered. On the first poll of a market only
     * the latest completed candle is delivered.
     */
    public int pollOnce() {
        Timeframe timeframe = properties.touch().candleTimeframe();
        Instant now = Instant.now();
        int submitted = 0;
        for (String market : properties.markets()) {
            String symbol = marketDataService.normalizeMarket(market);
            if (symbol.isBlank()) {
                continue;
            }
            List<OhlcvCandle> completed;
            try {
                completed = completedCandles(marketDataService.fetchCandles(symbol, timeframe, POLL_CANDLE_COUNT),
                        timeframe, now);
            } catch (Exception e) {
                log.warn("Failed to poll candles for market={}, timeframe={}", symbol, timeframe.label(), e);
                continue;
            }
            if (completed.isEmpty()) {
                log.debug("No completed candle available for market={}", symbol);
                continue;
            }

            Instant last = lastDelivered.get(symbol);
            List<OhlcvCandle> fresh = last == null
                    ? List.of(completed.get(completed.size() - 1))
                    : completed.stream().filter(candle -> candle.timestamp().isAfter(last)).toList();
            for (OhlcvCandle candle : fresh) {
                accept(symbol, candle);
                submitted++;
            }
            if (!fresh.isEmpty()) {
                lastDelivered.put(symbol, fresh.get(fresh.size() - 1).timestamp());
            }
        }
        return submitted;
    }

    public CompletableFuture<ZoneStateService.TickUpdate> accept(String symbol, OhlcvCandle candle) {
        if (candle == null || !candle.isValid()) {
            throw new IllegalArgumentException("A valid price update is required");
        }
        return zoneStateService.onPriceUpdate(symbol, candle)
                .whenComplete((update, error) -> {
                    if (error != null) {
                        log.error("Failed to apply price update for market={}", symbol, error);
                    }
                });
    }

    private List<OhlcvCandle> completedCandles(List<OhlcvCandle> candles, Timeframe timeframe, Instant now) {
        if (candles == null) {
            return List.of();
        }
        return candles.stream()
                .filter(candle -> candle != null && candle.isValid())
                .filter(candle -> !candle.timestamp().plus(timeframe.duration()).isAfter(now))
                .toList();
    }
}
