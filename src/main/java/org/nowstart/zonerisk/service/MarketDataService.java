package org.nowstart.zonerisk.service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.zonerisk.data.dto.UpbitCandleResponse;
import org.nowstart.zonerisk.data.dto.UpbitOrderbookResponse;
import org.nowstart.zonerisk.data.dto.UpbitTickerResponse;
import org.nowstart.zonerisk.data.type.Timeframe;
import org.nowstart.zonerisk.repository.UpbitFeignClient;
import org.nowstart.zonerisk.zone.core.OhlcvCandle;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RefreshScope
@RequiredArgsConstructor
public class MarketDataService {

    static final int MAX_CANDLES_PER_REQUEST = 200;

    private final UpbitFeignClient upbitFeignClient;

    /**
     * Candles in ascending time order. Rows that cannot be parsed are skipped.
     */
    public List<OhlcvCandle> fetchCandles(String market, Timeframe timeframe, int count) {
        int requested = Math.max(1, Math.min(MAX_CANDLES_PER_REQUEST, count));
        List<UpbitCandleResponse> rows = switch (timeframe) {
            case M5 -> upbitFeignClient.getMinuteCandles(5, market, requested);
            case M15 -> upbitFeignClient.getMinuteCandles(15, market, requested);
            case H1 -> upbitFeignClient.getMinuteCandles(60, market, requested);
            case H4 -> upbitFeignClient.getMinuteCandles(240, market, requested);
            case D1 -> upbitFeignClient.getDayCandles(market, requested);
            case W1 -> upbitFeignClient.getWeekCandles(market, requested);
        };
        if (rows == null || rows.isEmpty()) {
            log.warn("No candles received from exchange. market={}, timeframe={}, requestedCount={}",
                    market, timeframe.label(), requested);
            return List.of();
        }

        List<OhlcvCandle> candles = rows.stream()
                .map(this::toCandle)
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(OhlcvCandle::timestamp))
                .toList();
        if (candles.isEmpty()) {
            log.warn("No valid candles after normalization. market={}, timeframe={}, rawCount={}",
                    market, timeframe.label(), rows.size());
        }
        return candles;
    }

    public UpbitOrderbookResponse fetchOrderbook(String market) {
        List<UpbitOrderbookResponse> orderbooks = upbitFeignClient.getOrderbooks(market);
        if (orderbooks == null || orderbooks.isEmpty()) {
            return null;
        }
        return orderbooks.get(0);
    }

    /**
     * Latest trade as a tick candle, or null when the ticker is unavailable.
     */
    public OhlcvCandle fetchLatestTick(String market) {
        try {
            List<UpbitTickerResponse> tickers = upbitFeignClient.getTickers(market);
            if (tickers == null || tickers.isEmpty() || tickers.get(0) == null || tickers.get(0).trade_price() == null) {
                return null;
            }

            UpbitTickerResponse ticker = tickers.get(0);
            double tradePrice = ticker.trade_price().doubleValue();
            if (!Double.isFinite(tradePrice) || tradePrice <= 0.0) {
                return null;
            }
            double volume = ticker.trade_volume() == null ? 0.0 : ticker.trade_volume().doubleValue();
            Instant timestamp = ticker.trade_timestamp() == null
                    ? Instant.now()
                    : Instant.ofEpochMilli(ticker.trade_timestamp());
            return OhlcvCandle.tick(timestamp, tradePrice, volume);
        } catch (Exception e) {
            log.debug("Failed to resolve live price for market={}", market, e);
            return null;
        }
    }

    public double resolveLivePrice(String market, double fallbackClose) {
        double fallback = (Double.isFinite(fallbackClose) && fallbackClose > 0.0) ? fallbackClose : Double.NaN;
        OhlcvCandle tick = fetchLatestTick(market);
        return tick == null ? fallback : tick.close();
    }

    public String normalizeMarket(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().toUpperCase(Locale.ROOT);
    }

    private OhlcvCandle toCandle(UpbitCandleResponse row) {
        if (row == null
                || row.candle_date_time_utc() == null
                || row.opening_price() == null
                || row.high_price() == null
                || row.low_price() == null
                || row.trade_price() == null) {
            return null;
        }

        try {
            BigDecimal volume = row.candle_acc_trade_volume() == null ? BigDecimal.ZERO : row.candle_acc_trade_volume();
            return new OhlcvCandle(
                    LocalDateTime.parse(row.candle_date_time_utc()).toInstant(ZoneOffset.UTC),
                    row.opening_price().doubleValue(),
                    row.high_price().doubleValue(),
                    row.low_price().doubleValue(),
                    row.trade_price().doubleValue(),
                    volume.doubleValue()
            );
        } catch (Exception e) {
            log.warn("Failed to parse candle row. row={}", row, e);
            return null;
        }
    }
}
