package org.nowstart.zonerisk.zone;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.zonerisk.ZoneRiskPropertiesFixture;
import org.nowstart.zonerisk.data.type.Timeframe;
import org.nowstart.zonerisk.data.type.ZoneTier;
import org.nowstart.zonerisk.zone.core.OhlcvCandle;
import org.nowstart.zonerisk.zone.core.RawLevel;
import org.nowstart.zonerisk.zone.core.TouchRecord;
import org.nowstart.zonerisk.zone.core.ZoneCluster;

class TouchHistoryTrackerTest {

    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");

    private final TouchHistoryTracker tracker =
            new TouchHistoryTracker(ZoneRiskPropertiesFixture.defaults(), new RejectionScorer());

    @Test
    void onPriceUpdate_recordsTouchAfterFollowThrough() {
        ZoneBook book = bookWithZoneAt(100.0, 20);

        assertThat(tracker.onPriceUpdate(book, candle(0, 104.0, 104.0, 101.0, 103.5))).isEmpty();
        assertThat(tracker.onPriceUpdate(book, candle(1, 105.0, 106.5, 104.0, 106.0))).isEmpty();
        assertThat(tracker.onPriceUpdate(book, candle(2, 106.0, 108.5, 105.0, 108.0))).isEmpty();
        List<TouchHistoryTracker.RecordedTouch> recorded =
                tracker.onPriceUpdate(book, candle(3, 108.0, 108.0, 106.0, 107.0));

        assertThat(recorded).hasSize(1);
        TouchRecord touch = recorded.get(0).touch();
        assertThat(touch.timestamp()).isEqualTo(START);
        assertThat(touch.touchPrice()).isEqualTo(101.0);
        assertThat(touch.volumeRatio()).isEqualTo(1.0);
        // wick 3.0 (capped) + bounce 0.625 + follow-through 0.9
        assertThat(touch.rejectionStrength()).isCloseTo(4.525, within(1e-9));
        assertThat(book.trackedZones().get(0).touchHistory()).containsExactly(touch);
    }

    @Test
    void onPriceUpdate_countsSustainedContactAsOneTouch() {
        ZoneBook book = bookWithZoneAt(100.0, 20);

        for (int i = 0; i < 6; i++) {
            tracker.onPriceUpdate(book, candle(i, 101.0, 101.5, 99.0, 100.5));
        }

        assertThat(book.trackedZones().get(0).touchHistory()).hasSize(1);
        assertThat(book.trackedZones().get(0).isInContact()).isTrue();
    }

    @Test
    void onPriceUpdate_keepsOnlyMostRecentTouches() {
        ZoneBook book = bookWithZoneAt(100.0, 2);

        int minute = 0;
        for (int round = 0; round < 3; round++) {
            tracker.onPriceUpdate(book, candle(minute++, 104.0, 104.0, 101.0, 103.5));
            for (int i = 0; i < 3; i++) {
                tracker.onPriceUpdate(book, candle(minute++, 105.0, 106.0, 104.0, 105.5));
            }
        }

        List<TouchRecord> history = book.trackedZones().get(0).touchHistory();
        assertThat(history).hasSize(2);
        assertThat(history).extracting(TouchRecord::timestamp)
                .containsExactly(START.plusSeconds(4 * 60), START.plusSeconds(8 * 60));
    }

    @Test
    void onPriceUpdate_measuresVolumeAgainstRecentAverage() {
        ZoneBook book = bookWithZoneAt(100.0, 20);
        tracker.onPriceUpdate(book, new OhlcvCandle(START, 120.0, 120.0, 120.0, 120.0, 10.0));
        tracker.onPriceUpdate(book, new OhlcvCandle(START.plusSeconds(60), 120.0, 120.0, 120.0, 120.0, 10.0));

        tracker.onPriceUpdate(book, new OhlcvCandle(START.plusSeconds(120), 104.0, 104.0, 101.0, 103.5, 30.0));
        PendingTouch pending = book.trackedZones().get(0).getPendingTouch();

        assertThat(pending).isNotNull();
        assertThat(pending.getVolumeRatio()).isCloseTo(3.0, within(1e-9));
        assertThat(pending.isSupportTest()).isTrue();
    }

    @Test
    void onPriceUpdate_ignoresUpdatesWithoutAtr() {
        ZoneBook book = new ZoneBook("KRW-BTC", 20, 20);
        book.reconcile(List.of(cluster(100.0)), Double.NaN, 3);

        assertThat(tracker.onPriceUpdate(book, candle(0, 100.0, 100.0, 100.0, 100.0))).isEmpty();
        assertThat(book.trackedZones().get(0).getPendingTouch()).isNull();
    }

    @Test
    void isInBand_acceptsCloseNearCenterOrRangeCrossingBand() {
        assertThat(tracker.isInBand(candle(0, 102.0, 102.0, 102.0, 102.0), 100.0, 3.0)).isTrue();
        assertThat(tracker.isInBand(candle(0, 110.0, 110.0, 96.0, 109.0), 100.0, 3.0)).isTrue();
        assertThat(tracker.isInBand(candle(0, 105.0, 106.0, 103.5, 105.0), 100.0, 3.0)).isFalse();
    }

    private ZoneBook bookWithZoneAt(double center, int historyWindow) {
        ZoneBook book = new ZoneBook("KRW-BTC", historyWindow, 20);
        book.reconcile(List.of(cluster(center)), 10.0, 3);
        return book;
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
