package org.nowstart.zonerisk.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.nowstart.zonerisk.ZoneRiskPropertiesFixture;
import org.nowstart.zonerisk.data.property.ZoneRiskProperties;
import org.nowstart.zonerisk.data.type.Timeframe;
import org.nowstart.zonerisk.data.type.ZoneTier;
import org.nowstart.zonerisk.repository.TouchHistoryStore;
import org.nowstart.zonerisk.repository.UpbitFeignClient;
import org.nowstart.zonerisk.zone.RejectionScorer;
import org.nowstart.zonerisk.zone.StrengthScorer;
import org.nowstart.zonerisk.zone.TouchHistoryTracker;
import org.nowstart.zonerisk.zone.core.OhlcvCandle;
import org.nowstart.zonerisk.zone.core.RawLevel;
import org.nowstart.zonerisk.zone.core.TouchRecord;
import org.nowstart.zonerisk.zone.core.Zone;
import org.nowstart.zonerisk.zone.core.ZoneCluster;
import org.nowstart.zonerisk.zone.core.ZoneSnapshot;

class ZoneStateServiceTest {

    private static final String SYMBOL = "KRW-BTC";
    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private final ZoneRiskProperties properties = ZoneRiskPropertiesFixture.defaults();
    private TouchHistoryStore store;
    private ZoneStateService service;

    @BeforeEach
    void setUp() {
        store = new TouchHistoryStore(new ObjectMapper(), 0.001).open(tempDir.resolve("history.json"));
        service = newService(store);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        service.shutdown();
    }

    @Test
    void snapshot_isEmptyBeforeFirstCycle() {
        ZoneSnapshot snapshot = service.snapshot(SYMBOL);

        assertThat(snapshot.version()).isZero();
        assertThat(snapshot.zones()).isEmpty();
    }

    @Test
    void applyCycle_publishesIncreasingVersionsAndStagesHistory() {
        ZoneStateService.CycleUpdate first = service.applyCycle(SYMBOL, List.of(cluster(100.0)), 10.0).join();
        ZoneStateService.CycleUpdate second = service.applyCycle(SYMBOL, List.of(cluster(101.0), cluster(200.0)), 10.0).join();

        assertThat(first.snapshot().version()).isEqualTo(1L);
        assertThat(second.snapshot().version()).isEqualTo(2L);
        assertThat(second.result().matched()).isEqualTo(1);
        assertThat(second.result().created()).isEqualTo(1);
        assertThat(service.snapshot(SYMBOL)).isSameAs(second.snapshot());
        assertThat(store.isDirty()).isTrue();
        assertThat(store.load(SYMBOL).seeds()).hasSize(2);
    }

    @Test
    void onPriceUpdate_bumpsVersionOnlyWhenTouchIsRecorded() {
        service.applyCycle(SYMBOL, List.of(cluster(100.0)), 10.0).join();

        ZoneStateService.TickUpdate touching = service.onPriceUpdate(SYMBOL, candle(0, 104.0, 104.0, 101.0, 103.5)).join();
        service.onPriceUpdate(SYMBOL, candle(1, 105.0, 106.5, 104.0, 106.0)).join();
        service.onPriceUpdate(SYMBOL, candle(2, 106.0, 108.5, 105.0, 108.0)).join();
        ZoneStateService.TickUpdate finished = service.onPriceUpdate(SYMBOL, candle(3, 108.0, 108.0, 106.0, 107.0)).join();

        assertThat(touching.recorded()).isEmpty();
        assertThat(touching.snapshot().version()).isEqualTo(1L);
        assertThat(finished.recorded()).hasSize(1);
        assertThat(finished.snapshot().version()).isEqualTo(2L);
        assertThat(finished.snapshot().zones().get(0).touches()).hasSize(1);
    }

    @Test
    void snapshot_readersSeeConsistentStateWhileWriterRuns() {
        List<CompletableFuture<ZoneStateService.CycleUpdate>> updates = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            updates.add(service.applyCycle(SYMBOL, List.of(cluster(100.0 + i), cluster(300.0 + i)), 10.0));
        }

        for (int i = 0; i < 200; i++) {
            ZoneSnapshot snapshot = service.snapshot(SYMBOL);
            assertThat(snapshot.zones().size()).isIn(0, 2);
        }
        CompletableFuture.allOf(updates.toArray(CompletableFuture[]::new)).join();

        assertThat(service.snapshot(SYMBOL).version()).isEqualTo(20L);
    }

    @Test
    void restorePersistedZones_seedsBooksFromStore() throws Exception {
        TouchRecord touch = new TouchRecord(START, 99.0, 6.5, 1.4);
        store.replaceSymbol(SYMBOL, List.of(new Zone(
                9L, 100.0, 5.0, List.of(), ZoneTier.MAJOR, Timeframe.D1, 7.0, 2, List.of(touch, touch), false, 0
        )), 12.0);
        store.flush();
        TouchHistoryStore reopened = new TouchHistoryStore(new ObjectMapper(), 0.001)
                .open(tempDir.resolve("history.json"));
        ZoneStateService restoredService = newService(reopened);

        try {
            restoredService.restorePersistedZones();

            ZoneSnapshot snapshot = restoredService.snapshot(SYMBOL);
            assertThat(snapshot.version()).isEqualTo(1L);
            assertThat(snapshot.atr()).isEqualTo(12.0);
            assertThat(snapshot.zones()).hasSize(1);
            assertThat(snapshot.zones().get(0).touches()).containsExactly(touch, touch);
            assertThat(snapshot.zones().get(0).lowConfidence()).isFalse();
        } finally {
            restoredService.shutdown();
        }
    }

    @Test
    void restorePersistedZones_normalizesConfiguredMarkets() throws Exception {
        store.replaceSymbol(SYMBOL, List.of(new Zone(
                3L, 100.0, 5.0, List.of(), ZoneTier.INTERMEDIATE, Timeframe.H1, 5.0, 1, List.of(), true, 0, 1.0
        )), 10.0);
        store.flush();
        TouchHistoryStore reopened = new TouchHistoryStore(new ObjectMapper(), 0.001)
                .open(tempDir.resolve("history.json"));
        ZoneStateService restoredService = newService(
                reopened,
                ZoneRiskPropertiesFixture.withMarkets(List.of(" krw-btc", "KRW-BTC"))
        );

        try {
            restoredService.restorePersistedZones();

            ZoneSnapshot snapshot = restoredService.snapshot(SYMBOL);
            assertThat(snapshot.version()).isEqualTo(1L);
            assertThat(snapshot.zones()).extracting(Zone::priceCenter).containsExactly(100.0);
            assertThat(restoredService.snapshot("krw-btc").zones()).isEmpty();
        } finally {
            restoredService.shutdown();
        }
    }

    @Test
    void restorePersistedZones_keepsStrengthOfPersistedZones() throws Exception {
        ZoneCluster confluent = new ZoneCluster(
                100.0,
                5.0,
                List.of(
                        new RawLevel(100.0, "pivot", 1.0, Timeframe.H1),
                        new RawLevel(100.5, "swing", 0.8, Timeframe.H4),
                        new RawLevel(99.5, "SMA200", 1.5, Timeframe.D1)
                ),
                3,
                Timeframe.D1,
                ZoneTier.MAJOR,
                3.3
        );
        Zone published = service.applyCycle(SYMBOL, List.of(confluent), 10.0).join().snapshot().zones().get(0);
        store.flush();
        TouchHistoryStore reopened = new TouchHistoryStore(new ObjectMapper(), 0.001)
                .open(tempDir.resolve("history.json"));
        ZoneStateService restoredService = newService(reopened);

        try {
            restoredService.restorePersistedZones();

            Zone restored = restoredService.snapshot(SYMBOL).zones().get(0);
            assertThat(restored.confluenceCount()).isEqualTo(3);
            assertThat(restored.sourceWeight()).isEqualTo(3.3);
            assertThat(restored.strengthScore()).isEqualTo(published.strengthScore());
        } finally {
            restoredService.shutdown();
        }
    }

    @Test
    void shutdown_stopsWriter() throws Exception {
        service.applyCycle(SYMBOL, List.of(cluster(100.0)), 10.0).get(5, TimeUnit.SECONDS);

        service.shutdown();

        assertThatThrownBy(() -> service.applyCycle(SYMBOL, List.of(), 10.0))
                .isInstanceOf(RejectedExecutionException.class);
    }

    private ZoneStateService newService(TouchHistoryStore touchHistoryStore) {
        return newService(touchHistoryStore, properties);
    }

    private ZoneStateService newService(TouchHistoryStore touchHistoryStore, ZoneRiskProperties serviceProperties) {
        return new ZoneStateService(
                serviceProperties,
                new TouchHistoryTracker(serviceProperties, new RejectionScorer()),
                new StrengthScorer(serviceProperties),
                new TouchHistoryPersistenceService(touchHistoryStore),
                new MarketDataService(mock(UpbitFeignClient.class))
        );
    }

    private ZoneCluster cluster(double center) {
        return new ZoneCluster(
                center,
                5.0,
                List.of(new RawLevel(center, "pivot", 1.0, Timeframe.H1)),
                1,
                Timeframe.H1,
                ZoneTier.INTERMEDIATE,
                1.0
        );
    }

    private OhlcvCandle candle(int minute, double open, double high, double low, double close) {
        return new OhlcvCandle(START.plusSeconds(minute * 60L), open, high, low, close, 1.0);
    }
}
