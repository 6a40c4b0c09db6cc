package org.nowstart.zonerisk.zone.core;

import java.util.List;
import org.nowstart.zonerisk.data.type.Timeframe;
import org.nowstart.zonerisk.data.type.ZoneTier;

/**
 * Zone state restored from durable storage before the first evaluation cycle has run.
 */
public record ZoneSeed(
        double priceCenter,
        double mergeRadius,
        ZoneTier tier,
        Timeframe primaryTimeframe,
        double totalWeight,
        int confluenceCount,
        List<TouchRecord> touches
) {

    public ZoneSeed {
        touches = touches == null ? List.of() : List.copyOf(touches);
    }
}
