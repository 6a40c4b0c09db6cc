package org.nowstart.zonerisk.zone.core;

import org.nowstart.zonerisk.data.type.Timeframe;

public record RawLevel(
        double price,
        String sourceTag,
        double sourceWeight,
        Timeframe timeframe
) {

    public boolean isUsable() {
        return Double.isFinite(price)
                && price > 0.0
                && Double.isFinite(sourceWeight)
                && sourceWeight > 0.0
                && timeframe != null;
    }
}
