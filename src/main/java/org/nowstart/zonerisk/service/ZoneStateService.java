package org.nowstart.zonerisk.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.zonerisk.data.property.ZoneRiskProperties;
import org.nowstart.zonerisk.repository.TouchHistoryStore;
import org.nowstart.zonerisk.zone.StrengthScorer;
import org.nowstart.zonerisk.zone.TouchHistoryTracker;
import org.nowstart.zonerisk.zone.ZoneBook;
import org.nowstart.zonerisk.zone.core.OhlcvCandle;
import org.nowstart.zonerisk.zone.core.ZoneCluster;
import org.nowstart.zonerisk.zone.core.ZoneSnapshot;
import org.springframework.stereotype.Service;

/**
 * Sole owner of mutable zone state. Cycle results and price updates are applied on one writer thread;
 * after every change to zones or touch history a new immutable {@link ZoneSnapshot} with a higher
 * version is published. Readers never block.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ZoneStateService {

    private final ZoneRiskProperties properties;
    private final TouchHistoryTracker touchHistoryTracker;
    private final StrengthScorer strengthScorer;
    private final TouchHistoryPersistenceService persistenceService;
    private final MarketDataService marketDataService;
    private final ExecutorService writer = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "zone-state-writer");
        thread.setDaemon(true);
        return thread;
    });
    private final Map<String, ZoneBook> books = new HashMap<>();
    private final Map<String, AtomicReference<ZoneSnapshot>> snapshots = new ConcurrentHashMap<>();

    @PostConstruct
    void restorePersistedZones() {
        List<String> symbols = properties.markets().stream()
                .map(marketDataService::normalizeMarket)
                .filter(symbol -> !symbol.isBlank())
                .distinct()
                .toList();
        for (String symbol : symbols) {
            submit(() -> {
                TouchHistoryStore.RestoredZones restored = persistenceService.restore(symbol);
                if (restored.seeds().isEmpty()) {
                    return null;
                }
                ZoneBook book = bookFor(symbol);
                book.restore(restored.seeds(), restored.atr());
                ZoneSnapshot snapshot = publish(book);
                log.info("event=zone_state_restored symbol={} zones={} version={}",
                        symbol, snapshot.zones().size(), snapshot.version());
                return null;
            }).join();
        }
    }

    @PreDestroy
    void shutdown() throws InterruptedException {
        writer.shutdown();
        if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
            log.warn("event=zone_state_writer_shutdown status=timeout");
            writer.shutdownNow();
        }
    }

    public ZoneSnapshot snapshot(String symbol) {
        AtomicReference<ZoneSnapshot> reference = snapshots.get(symbol);
        if (reference == null) {
            return ZoneSnapshot.empty(symbol);
        }
        return reference.get();
    }

    public CompletableFuture<CycleUpdate> applyCycle(String symbol, List<ZoneCluster> clusters, double cycleAtr) {
        return submit(() -> {
            ZoneBook book = bookFor(symbol);
            ZoneBook.ReconcileResult result = book.reconcile(
                    clusters,
                    cycleAtr,
                    properties.clustering().graceCycles()
            );
            ZoneSnapshot snapshot = publish(book);
            return new CycleUpdate(snapshot, result);
        });
    }

    public CompletableFuture<TickUpdate> onPriceUpdate(String symbol, OhlcvCandle candle) {
        return submit(() -> {
            ZoneBook book = bookFor(symbol);
            List<TouchHistoryTracker.RecordedTouch> recorded = touchHistoryTracker.onPriceUpdate(book, candle);
            ZoneSnapshot snapshot = recorded.isEmpty() ? snapshot(symbol) : publish(book);
            return new TickUpdate(snapshot, recorded);
        });
    }

    private <T> CompletableFuture<T> submit(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, writer);
    }

    private ZoneBook bookFor(String symbol) {
        return books.computeIfAbsent(symbol, key -> new ZoneBook(
                key,
                properties.touch().historyWindow(),
                properties.touch().volumeLookback()
        ));
    }

    private ZoneSnapshot publish(ZoneBook book) {
        AtomicReference<ZoneSnapshot> reference = snapshots.computeIfAbsent(
                book.getSymbol(),
                key -> new AtomicReference<>(ZoneSnapshot.empty(key))
        );
        long version = reference.get().version() + 1;
        ZoneSnapshot snapshot = book.toSnapshot(version, Instant.now(), strengthScorer);
        reference.set(snapshot);
        persistenceService.stage(snapshot);
        return snapshot;
    }

    public record CycleUpdate(ZoneSnapshot snapshot, ZoneBook.ReconcileResult result) {
    }

    public record TickUpdate(ZoneSnapshot snapshot, List<TouchHistoryTracker.RecordedTouch> recorded) {
    }
}
