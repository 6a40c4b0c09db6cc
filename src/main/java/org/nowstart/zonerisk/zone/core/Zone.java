package org.nowstart.zonerisk.zone.core;

import java.util.List;
import org.nowstart.zonerisk.data.type.StrengthTier;
import org.nowstart.zonerisk.data.type.Timeframe;
import org.nowstart.zonerisk.data.type.ZoneTier;

/**
 * Immutable view of a tracked zone as published in a {@link ZoneSnapshot}.
 */
public record Zone(
        long id,
        double priceCenter,
        double mergeRadius,
        List<RawLevel> memberLevels,
        ZoneTier tier,
        Timeframe primaryTimeframe,
        double strengthScore,
        int confluenceCount,
        List<TouchRecord> touches,
        boolean lowConfidence,
        int missedCycles,
        double sourceWeight
) {

    public Zone {
        memberLevels = memberLevels == null ? List.of() : List.copyOf(memberLevels);
        touches = touches == null ? List.of() : List.copyOf(touches);
    }

    /**
     * Zone whose source weight is the summed weight of its member levels.
     */
    public Zone(
            long id,
            double priceCenter,
            double mergeRadius,
            List<RawLevel> memberLevels,
            ZoneTier tier,
            Timeframe primaryTimeframe,
            double strengthScore,
            int confluenceCount,
            List<TouchRecord> touches,
            boolean lowConfidence,
            int missedCycles
    ) {
        this(id, priceCenter, mergeRadius, memberLevels, tier, primaryTimeframe, strengthScore, confluenceCount,
                touches, lowConfidence, missedCycles, memberWeight(memberLevels));
    }

    public StrengthTier strengthTier() {
        return StrengthTier.of(strengthScore);
    }

    public int touchCount() {
        return touches.size();
    }

    public double distanceTo(double price) {
        return Math.abs(priceCenter - price);
    }

    private static double memberWeight(List<RawLevel> memberLevels) {
        return memberLevels == null ? 0.0 : memberLevels.stream().mapToDouble(RawLevel::sourceWeight).sum();
    }

    public List<String> sourceTags() {
        return memberLevels.stream()
                .map(RawLevel::sourceTag)
                .distinct()
                .toList();
    }
}
