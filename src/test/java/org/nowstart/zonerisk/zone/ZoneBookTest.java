package org.nowstart.zonerisk.zone;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.zonerisk.ZoneRiskPropertiesFixture;
import org.nowstart.zonerisk.data.type.Timeframe;
import org.nowstart.zonerisk.data.type.ZoneTier;
import org.nowstart.zonerisk.zone.core.RawLevel;
import org.nowstart.zonerisk.zone.core.TouchRecord;
import org.nowstart.zonerisk.zone.core.Zone;
import org.nowstart.zonerisk.zone.core.ZoneCluster;
import org.nowstart.zonerisk.zone.core.ZoneSeed;
import org.nowstart.zonerisk.zone.core.ZoneSnapshot;

class ZoneBookTest {

    private static final Instant NOW = Instant.parse("2024-03-01T00:00:00Z");

    private final StrengthScorer scorer = new StrengthScorer(ZoneRiskPropertiesFixture.defaults());

    @Test
    void reconcile_createsZonesForNewClusters() {
        ZoneBook book = new ZoneBook("KRW-BTC", 20, 20);

        ZoneBook.ReconcileResult result = book.reconcile(List.of(cluster(100.0), cluster(200.0)), 10.0, 3);

        assertThat(result).isEqualTo(new ZoneBook.ReconcileResult(0, 2, 0));
        assertThat(book.size()).isEqualTo(2);
        assertThat(book.getAtr()).isEqualTo(10.0);
    }

    @Test
    void reconcile_keepsIdAndHistoryWhenClusterDriftsWithinRadius() {
        ZoneBook book = new ZoneBook("KRW-BTC", 20, 20);
        book.reconcile(List.of(cluster(100.0)), 10.0, 3);
        TrackedZone original = book.trackedZones().get(0);
        original.appendTouch(new TouchRecord(NOW, 99.0, 6.0, 1.2), 20);

        ZoneBook.ReconcileResult result = book.reconcile(List.of(cluster(103.0)), 10.0, 3);

        assertThat(result.matched()).isEqualTo(1);
        assertThat(result.created()).isZero();
        TrackedZone updated = book.trackedZones().get(0);
        assertThat(updated.getId()).isEqualTo(original.getId());
        assertThat(updated.getPriceCenter()).isEqualTo(103.0);
        assertThat(updated.touchHistory()).hasSize(1);
    }

    @Test
    void reconcile_matchesEachZoneAtMostOnce() {
        ZoneBook book = new ZoneBook("KRW-BTC", 20, 20);
        book.reconcile(List.of(cluster(100.0)), 10.0, 3);

        ZoneBook.ReconcileResult result = book.reconcile(List.of(cluster(98.0), cluster(101.0)), 10.0, 3);

        assertThat(result.matched()).isEqualTo(1);
        assertThat(result.created()).isEqualTo(1);
        assertThat(book.trackedZones()).extracting(TrackedZone::getId).containsExactlyInAnyOrder(1L, 2L);
        assertThat(book.trackedZones().stream().filter(zone -> zone.getId() == 1L).findFirst().orElseThrow()
                .getPriceCenter()).isEqualTo(101.0);
    }

    @Test
    void reconcile_dropsZoneAfterGraceCycles() {
        ZoneBook book = new ZoneBook("KRW-BTC", 20, 20);
        book.reconcile(List.of(cluster(100.0)), 10.0, 3);

        book.reconcile(List.of(), 10.0, 3);
        book.reconcile(List.of(), 10.0, 3);
        assertThat(book.size()).isEqualTo(1);
        assertThat(book.trackedZones().get(0).getMissedCycles()).isEqualTo(2);

        ZoneBook.ReconcileResult result = book.reconcile(List.of(), 10.0, 3);

        assertThat(result.expired()).isEqualTo(1);
        assertThat(book.size()).isZero();
    }

    @Test
    void reconcile_keepsPreviousAtrWhenCycleAtrIsMissing() {
        ZoneBook book = new ZoneBook("KRW-BTC", 20, 20);
        book.reconcile(List.of(cluster(100.0)), 10.0, 3);

        book.reconcile(List.of(cluster(100.0)), Double.NaN, 3);

        assertThat(book.getAtr()).isEqualTo(10.0);
    }

    @Test
    void restore_seedsZonesWithBoundedHistory() {
        ZoneBook book = new ZoneBook("KRW-BTC", 2, 20);
        List<TouchRecord> touches = List.of(
                new TouchRecord(NOW, 99.0, 4.0, 1.0),
                new TouchRecord(NOW.plusSeconds(60), 99.5, 5.0, 1.0),
                new TouchRecord(NOW.plusSeconds(120), 99.8, 6.0, 1.0)
        );

        book.restore(List.of(new ZoneSeed(100.0, 5.0, ZoneTier.MAJOR, Timeframe.D1, 3.5, 2, touches)), 12.0);

        assertThat(book.size()).isEqualTo(1);
        assertThat(book.getAtr()).isEqualTo(12.0);
        assertThat(book.trackedZones().get(0).touchHistory())
                .extracting(TouchRecord::rejectionStrength)
                .containsExactly(5.0, 6.0);
        assertThat(book.trackedZones().get(0).getTotalWeight()).isEqualTo(3.5);
        assertThat(book.trackedZones().get(0).getConfluenceCount()).isEqualTo(2);
    }

    @Test
    void restore_treatsMissingConfluenceAsSingleSource() {
        ZoneBook book = new ZoneBook("KRW-BTC", 20, 20);

        book.restore(List.of(new ZoneSeed(100.0, 5.0, ZoneTier.MINOR, Timeframe.M15, 0.0, 0, List.of())), 12.0);

        assertThat(book.trackedZones().get(0).getConfluenceCount()).isEqualTo(1);
        assertThat(book.trackedZones().get(0).getTotalWeight()).isZero();
    }

    @Test
    void toSnapshot_publishesScoredImmutableZones() {
        ZoneBook book = new ZoneBook("KRW-BTC", 20, 20);
        book.reconcile(List.of(cluster(200.0), cluster(100.0)), 10.0, 3);

        ZoneSnapshot snapshot = book.toSnapshot(7L, NOW, scorer);

        assertThat(snapshot.version()).isEqualTo(7L);
        assertThat(snapshot.symbol()).isEqualTo("KRW-BTC");
        assertThat(snapshot.atr()).isEqualTo(10.0);
        assertThat(snapshot.zones()).extracting(Zone::priceCenter).containsExactly(100.0, 200.0);
        assertThat(snapshot.zones()).allSatisfy(zone -> {
            assertThat(zone.strengthScore()).isBetween(0.0, StrengthScorer.MAX_SCORE);
            assertThat(zone.lowConfidence()).isTrue();
        });
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
}
