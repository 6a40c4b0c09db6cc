package org.nowstart.zonerisk.zone;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.zonerisk.data.property.ZoneRiskProperties;
import org.nowstart.zonerisk.zone.core.OhlcvCandle;
import org.nowstart.zonerisk.zone.core.TouchRecord;
import org.springframework.stereotype.Component;

/**
 * Detects zone touches from price updates and turns each into a {@link TouchRecord} once its
 * follow-through has been observed. Must only be called from the zone state writer thread.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TouchHistoryTracker {

    private final ZoneRiskProperties properties;
    private final RejectionScorer rejectionScorer;

    public List<RecordedTouch> onPriceUpdate(ZoneBook book, OhlcvCandle candle) {
        if (candle == null || !candle.isValid()) {
            return List.of();
        }

        double atr = book.getAtr();
        List<RecordedTouch> recorded = new ArrayList<>();
        if (Double.isFinite(atr) && atr > 0.0) {
            double band = atr * properties.touch().touchAtrMultiplier().doubleValue();
            double averageVolume = book.averageVolume();
            for (TrackedZone zone : book.trackedZones()) {
                RecordedTouch touch = update(book, zone, candle, atr, band, averageVolume);
                if (touch != null) {
                    recorded.add(touch);
                }
            }
        }
        book.recordVolume(candle.volume());
        return recorded;
    }

    private RecordedTouch update(
            ZoneBook book,
            TrackedZone zone,
            OhlcvCandle candle,
            double atr,
            double band,
            double averageVolume
    ) {
        RecordedTouch finished = null;
        PendingTouch pending = zone.getPendingTouch();
        if (pending != null) {
            pending.observe(candle);
            if (pending.getFollowUps() >= properties.touch().followThroughCandles()) {
                finished = finish(book, zone, pending);
                zone.setPendingTouch(null);
            }
        }

        boolean inBand = isInBand(candle, zone.getPriceCenter(), band);
        if (inBand && !zone.isInContact() && zone.getPendingTouch() == null) {
            zone.setPendingTouch(start(candle, zone.getPriceCenter(), atr, averageVolume));
        }
        zone.setInContact(inBand);
        return finished;
    }

    boolean isInBand(OhlcvCandle candle, double center, double band) {
        if (Math.abs(candle.close() - center) < band) {
            return true;
        }
        return candle.low() < center + band && candle.high() > center - band;
    }

    private PendingTouch start(OhlcvCandle candle, double center, double atr, double averageVolume) {
        boolean supportTest = candle.open() >= center;
        double touchExtreme = supportTest ? candle.low() : candle.high();
        double volumeRatio = averageVolume > 0.0 ? candle.volume() / averageVolume : 1.0;

        double immediate = rejectionScorer.wickScore(candle, supportTest)
                + rejectionScorer.volumeScore(volumeRatio)
                + rejectionScorer.bounceScore(candle, touchExtreme, atr);
        return new PendingTouch(
                candle.timestamp(),
                touchExtreme,
                candle.close(),
                supportTest,
                atr,
                volumeRatio,
                immediate
        );
    }

    private RecordedTouch finish(ZoneBook book, TrackedZone zone, PendingTouch pending) {
        double followThrough = rejectionScorer.followThroughScore(pending.getBestExcursion(), pending.getAtr());
        TouchRecord touch = new TouchRecord(
                pending.getTimestamp(),
                pending.getTouchPrice(),
                rejectionScorer.total(pending.getImmediateScore(), followThrough),
                pending.getVolumeRatio()
        );
        zone.appendTouch(touch, book.historyWindow());
        log.info(
                "event=touch_recorded symbol={} zoneId={} center={} touchPrice={} rejection={} volumeRatio={} side={}",
                book.getSymbol(),
                zone.getId(),
                zone.getPriceCenter(),
                touch.touchPrice(),
                touch.rejectionStrength(),
                touch.volumeRatio(),
                pending.isSupportTest() ? "support" : "resistance"
        );
        return new RecordedTouch(zone.getId(), zone.getPriceCenter(), touch);
    }

    public record RecordedTouch(long zoneId, double zoneCenter, TouchRecord touch) {
    }
}
