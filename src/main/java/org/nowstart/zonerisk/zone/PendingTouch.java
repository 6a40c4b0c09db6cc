package org.nowstart.zonerisk.zone;

import java.time.Instant;
import lombok.Getter;
import org.nowstart.zonerisk.zone.core.OhlcvCandle;

/**
 * A touch whose wick, volume and bounce are known but whose follow-through is still being observed.
 */
@Getter
class PendingTouch {

    private final Instant timestamp;
    private final double touchPrice;
    private final double referenceClose;
    private final boolean supportTest;
    private final double atr;
    private final double volumeRatio;
    private final double immediateScore;
    private int followUps;
    private double bestExcursion;

    PendingTouch(
            Instant timestamp,
            double touchPrice,
            double referenceClose,
            boolean supportTest,
            double atr,
            double volumeRatio,
            double immediateScore
    ) {
        this.timestamp = timestamp;
        this.touchPrice = touchPrice;
        this.referenceClose = referenceClose;
        this.supportTest = supportTest;
        this.atr = atr;
        this.volumeRatio = volumeRatio;
        this.immediateScore = immediateScore;
    }

    void observe(OhlcvCandle candle) {
        followUps++;
        double excursion = supportTest
                ? candle.close() - referenceClose
                : referenceClose - candle.close();
        if (excursion > bestExcursion) {
            bestExcursion = excursion;
        }
    }
}
