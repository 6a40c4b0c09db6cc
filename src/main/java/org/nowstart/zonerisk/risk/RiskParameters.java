package org.nowstart.zonerisk.risk;

import org.nowstart.zonerisk.data.type.AnchorType;
import org.nowstart.zonerisk.zone.core.Zone;

/**
 * Stop-loss, take-profit and position sizing for one trade decision. {@code referenceZone} is the
 * zone the take-profit was anchored on, or null for a percentage fallback.
 */
public record RiskParameters(
        double entryPrice,
        double slPrice,
        double tpPrice,
        AnchorType slType,
        AnchorType tpType,
        double positionMultiplier,
        Zone referenceZone,
        double riskReward,
        RiskRationale rationale
) {
}
