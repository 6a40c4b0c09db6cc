package org.nowstart.zonerisk.zone.core;

import java.time.Instant;

/**
 * One price update. Polled candles and pushed updates share this shape; a bare ticker trade is a
 * candle whose open, high, low and close are equal.
 */
public record OhlcvCandle(
        Instant timestamp,
        double open,
        double high,
        double low,
        double close,
        double volume
) {

    public static OhlcvCandle tick(Instant timestamp, double price, double volume) {
        return new OhlcvCandle(timestamp, price, price, price, price, volume);
    }

    public double range() {
        return high - low;
    }

    public boolean isValid() {
        return timestamp != null
                && Double.isFinite(open)
                && Double.isFinite(high)
                && Double.isFinite(low)
                && Double.isFinite(close)
                && close > 0.0
                && high >= low;
    }
}
