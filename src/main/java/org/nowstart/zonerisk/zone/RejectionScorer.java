package org.nowstart.zonerisk.zone;

import org.nowstart.zonerisk.zone.core.OhlcvCandle;
import org.springframework.stereotype.Component;

/**
 * Scores how hard price was turned away from a zone on a touch. Four capped parts add up to at most 10.
 */
@Component
public class RejectionScorer {

    static final double MAX_WICK = 3.0;
    static final double MAX_VOLUME = 2.5;
    static final double MAX_BOUNCE = 2.5;
    static final double MAX_FOLLOW_THROUGH = 2.0;
    static final double MAX_TOTAL = 10.0;

    /**
     * Share of the candle range taken by the wick facing the zone. A support test looks at the lower
     * wick and a resistance test at the upper wick.
     */
    public double wickScore(OhlcvCandle candle, boolean supportTest) {
        double range = candle.range();
        if (!(range > 0.0)) {
            return 0.0;
        }
        double wick = supportTest
                ? Math.min(candle.open(), candle.close()) - candle.low()
                : candle.high() - Math.max(candle.open(), candle.close());
        return cap(wick / range * 5.0, MAX_WICK);
    }

    public double volumeScore(double volumeRatio) {
        if (!Double.isFinite(volumeRatio)) {
            return 0.0;
        }
        return cap((volumeRatio - 1.0) * 2.5, MAX_VOLUME);
    }

    public double bounceScore(OhlcvCandle candle, double touchExtreme, double atr) {
        if (!(atr > 0.0)) {
            return 0.0;
        }
        return cap(Math.abs(candle.close() - touchExtreme) / atr * 2.5, MAX_BOUNCE);
    }

    public double followThroughScore(double favourableExcursion, double atr) {
        if (!(atr > 0.0)) {
            return 0.0;
        }
        return cap(favourableExcursion / atr * 2.0, MAX_FOLLOW_THROUGH);
    }

    public double total(double immediateScore, double followThroughScore) {
        return cap(immediateScore + followThroughScore, MAX_TOTAL);
    }

    private double cap(double value, double max) {
        if (!Double.isFinite(value) || value <= 0.0) {
            return 0.0;
        }
        return Math.min(max, value);
    }
}
