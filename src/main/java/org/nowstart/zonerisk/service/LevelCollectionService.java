package org.nowstart.zonerisk.service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.zonerisk.data.exception.MissingDataException;
import org.nowstart.zonerisk.data.property.ZoneRiskProperties;
import org.nowstart.zonerisk.data.type.Timeframe;
import org.nowstart.zonerisk.indicator.IndicatorCalculator;
import org.nowstart.zonerisk.source.LevelSource;
import org.nowstart.zonerisk.source.LevelSourceContext;
import org.nowstart.zonerisk.source.LevelSourceRegistry;
import org.nowstart.zonerisk.source.PivotPointLevelSource;
import org.nowstart.zonerisk.zone.core.LevelBatch;
import org.nowstart.zonerisk.zone.core.OhlcvCandle;
import org.nowstart.zonerisk.zone.core.RawLevel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;

/**
 * Gathers one cycle's raw levels. Candles are fetched once per timeframe and shared; every enabled
 * source then runs on the level source pool under its own timeout. A source that fails, times out or
 * returns nothing contributes no levels.
 */
@Slf4j
@Service
@RefreshScope
public class LevelCollectionService {

    private final ZoneRiskProperties properties;
    private final MarketDataService marketDataService;
    private final LevelSourceRegistry levelSourceRegistry;
    private final IndicatorCalculator indicatorCalculator;
    private final ExecutorService levelSourceExecutor;

    public LevelCollectionService(
            ZoneRiskProperties properties,
            MarketDataService marketDataService,
            LevelSourceRegistry levelSourceRegistry,
            IndicatorCalculator indicatorCalculator,
            @Qualifier("levelSourceExecutor") ExecutorService levelSourceExecutor
    ) {
        this.properties = properties;
        this.marketDataService = marketDataService;
        this.levelSourceRegistry = levelSourceRegistry;
        this.indicatorCalculator = indicatorCalculator;
        this.levelSourceExecutor = levelSourceExecutor;
    }

    public CollectedLevels collect(String symbol) {
        List<LevelSource> sources = levelSourceRegistry.enabledSources();
        LevelSourceContext context = buildContext(symbol, sources);

        Map<LevelSource, CompletableFuture<List<LevelBatch>>> futures = new LinkedHashMap<>();
        for (LevelSource source : sources) {
            futures.put(source, CompletableFuture.supplyAsync(() -> source.collect(context), levelSourceExecutor));
        }

        long timeoutNanos = properties.evaluation().sourceTimeout().toNanos();
        long deadline = System.nanoTime() + timeoutNanos;
        List<LevelBatch> batches = new ArrayList<>();
        List<String> failedSources = new ArrayList<>();
        for (Map.Entry<LevelSource, CompletableFuture<List<LevelBatch>>> entry : futures.entrySet()) {
            String tag = entry.getKey().tag();
            try {
                List<LevelBatch> result = await(tag, entry.getValue(), deadline);
                if (result.stream().allMatch(LevelBatch::isEmpty)) {
                    throw new MissingDataException(tag, "Level source returned no levels");
                }
                batches.addAll(result);
            } catch (MissingDataException e) {
                failedSources.add(tag);
                log.warn("event=level_source_failed symbol={} source={} code={} reason={}",
                        symbol, tag, e.getCode(), e.getMessage());
            }
        }

        List<RawLevel> levels = batches.stream()
                .flatMap(batch -> batch.levels().stream())
                .toList();
        return new CollectedLevels(
                symbol,
                context.currentPrice(),
                resolveCycleAtr(context, batches),
                batches,
                levels,
                failedSources
        );
    }

    private List<LevelBatch> await(String tag, CompletableFuture<List<LevelBatch>> future, long deadline) {
        try {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            List<LevelBatch> result = future.get(remaining, TimeUnit.NANOSECONDS);
            return result == null ? List.of() : result;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new MissingDataException(tag, "Level source timed out", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof MissingDataException missing) {
                throw missing;
            }
            throw new MissingDataException(tag, "Level source failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MissingDataException(tag, "Interrupted while waiting for level source", e);
        }
    }

    private LevelSourceContext buildContext(String symbol, List<LevelSource> sources) {
        ZoneRiskProperties.Sources config = properties.sources();
        Set<Timeframe> timeframes = EnumSet.copyOf(config.timeframes());
        timeframes.add(config.atrTimeframe());
        timeframes.add(config.orderBookTimeframe());
        boolean pivotEnabled = sources.stream().anyMatch(source -> PivotPointLevelSource.TAG.equals(source.tag()));
        if (pivotEnabled) {
            timeframes.add(Timeframe.D1);
            timeframes.add(Timeframe.W1);
        }

        Map<Timeframe, List<OhlcvCandle>> candles = new EnumMap<>(Timeframe.class);
        Map<Timeframe, Double> atr = new EnumMap<>(Timeframe.class);
        for (Timeframe timeframe : timeframes) {
            List<OhlcvCandle> series = fetchQuietly(symbol, timeframe);
            if (series.isEmpty()) {
                continue;
            }
            candles.put(timeframe, series);
            double latestAtr = indicatorCalculator.latestAtr(series, config.atrPeriod());
            if (Double.isFinite(latestAtr) && latestAtr > 0.0) {
                atr.put(timeframe, latestAtr);
            }
        }

        double lastClose = candles.entrySet().stream()
                .findFirst()
                .map(entry -> entry.getValue().get(entry.getValue().size() - 1).close())
                .orElse(Double.NaN);
        double currentPrice = marketDataService.resolveLivePrice(symbol, lastClose);
        return new LevelSourceContext(symbol, currentPrice, candles, atr);
    }

    private List<OhlcvCandle> fetchQuietly(String symbol, Timeframe timeframe) {
        try {
            return marketDataService.fetchCandles(symbol, timeframe, properties.sources().candleCount());
        } catch (Exception e) {
            log.warn("event=candle_fetch_failed symbol={} timeframe={} reason={}",
                    symbol, timeframe.label(), e.getMessage(), e);
            return List.of();
        }
    }

    /**
     * ATR of the configured timeframe, else the largest ATR any batch reported.
     */
    double resolveCycleAtr(LevelSourceContext context, List<LevelBatch> batches) {
        double configured = context.atr(properties.sources().atrTimeframe());
        if (Double.isFinite(configured) && configured > 0.0) {
            return configured;
        }
        return batches.stream()
                .mapToDouble(LevelBatch::atr)
                .filter(value -> Double.isFinite(value) && value > 0.0)
                .max()
                .orElse(Double.NaN);
    }

    public record CollectedLevels(
            String symbol,
            double currentPrice,
            double atr,
            List<LevelBatch> batches,
            List<RawLevel> levels,
            List<String> failedSources
    ) {
    }
}
