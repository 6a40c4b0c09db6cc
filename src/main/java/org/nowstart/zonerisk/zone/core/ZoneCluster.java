package org.nowstart.zonerisk.zone.core;

import java.util.List;
import org.nowstart.zonerisk.data.type.Timeframe;
import org.nowstart.zonerisk.data.type.ZoneTier;

/**
 * Output of one clustering pass: levels merged around a source-weight-weighted center.
 *
 * @param priceCenter     weighted average of member prices
 * @param mergeRadius     radius used for this pass (ATR x multiplier)
 * @param members         member levels, ascending by price
 * @param confluenceCount number of distinct timeframes among members
 * @param primaryTimeframe highest timeframe among members
 * @param tier            tier of the primary timeframe
 * @param totalWeight     sum of member source weights
 */
public record ZoneCluster(
        double priceCenter,
        double mergeRadius,
        List<RawLevel> members,
        int confluenceCount,
        Timeframe primaryTimeframe,
        ZoneTier tier,
        double totalWeight
) {

    public ZoneCluster {
        members = List.copyOf(members);
    }
}
