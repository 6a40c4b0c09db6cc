package org.nowstart.zonerisk.data.dto;

import java.util.List;
import org.nowstart.zonerisk.data.type.StrengthTier;
import org.nowstart.zonerisk.data.type.Timeframe;
import org.nowstart.zonerisk.data.type.ZoneTier;
import org.nowstart.zonerisk.zone.core.TouchRecord;
import org.nowstart.zonerisk.zone.core.Zone;

public record ZoneDto(
        long id,
        double priceCenter,
        double mergeRadius,
        ZoneTier tier,
        Timeframe primaryTimeframe,
        double strengthScore,
        StrengthTier strengthTier,
        int confluenceCount,
        boolean lowConfidence,
        int missedCycles,
        List<String> sources,
        List<TouchRecord> touches
) {

    public static ZoneDto from(Zone zone) {
        return new ZoneDto(
                zone.id(),
                zone.priceCenter(),
                zone.mergeRadius(),
                zone.tier(),
                zone.primaryTimeframe(),
                zone.strengthScore(),
                zone.strengthTier(),
                zone.confluenceCount(),
                zone.lowConfidence(),
                zone.missedCycles(),
                zone.sourceTags(),
                zone.touches()
        );
    }
}
