package org.nowstart.zonerisk.regime;

import org.nowstart.zonerisk.data.type.TrendDirection;

/**
 * Market state observed at one instant.
 *
 * @param priceChange1h  close-to-close change over the last hour, as a fraction
 * @param volatility5m   (high - low) / close of the latest 5-minute candle
 * @param trend          direction of the prevailing trend
 */
public record RegimeInputs(
        double priceChange1h,
        double volatility5m,
        TrendDirection trend
) {

    public static RegimeInputs flat() {
        return new RegimeInputs(0.0, 0.0, TrendDirection.NEUTRAL);
    }
}
