package org.nowstart.zonerisk.zone;

import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.zonerisk.data.exception.InsufficientHistoryException;
import org.nowstart.zonerisk.data.property.ZoneRiskProperties;
import org.nowstart.zonerisk.data.type.ZoneTier;
import org.nowstart.zonerisk.zone.core.TouchRecord;
import org.nowstart.zonerisk.zone.core.Zone;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class StrengthScorer {

    public static final double MAX_SCORE = 10.0;
    static final double MAX_BASE_COMPONENT = 3.0;
    static final double MAX_TOUCH_QUALITY_COMPONENT = 3.0;
    static final double MAX_REJECTION_STRENGTH = 10.0;

    private final ZoneRiskProperties properties;

    public ZoneStrength score(double totalSourceWeight, ZoneTier tier, int confluenceCount, List<TouchRecord> touches) {
        List<TouchRecord> history = touches == null ? List.of() : touches;

        double base = baseWeightComponent(totalSourceWeight);
        double touchQuality = touchQualityComponent(history);
        double timeframe = (tier == null ? ZoneTier.MINOR : tier).timeframeWeight();
        double confluence = confluenceBonus(confluenceCount);
        double score = clamp(base + touchQuality + timeframe + confluence, 0.0, MAX_SCORE);

        boolean lowConfidence = false;
        try {
            requireConfidentHistory(history);
        } catch (InsufficientHistoryException e) {
            lowConfidence = true;
            log.debug("Zone scored with low confidence. touches={} required={}", e.getTouchCount(), e.getRequiredTouches());
        }

        return new ZoneStrength(score, base, touchQuality, timeframe, confluence, lowConfidence);
    }

    public void requireConfidentHistory(List<TouchRecord> touches) {
        int required = properties.scoring().minConfidentTouches();
        int count = touches == null ? 0 : touches.size();
        if (count < required) {
            throw new InsufficientHistoryException(count, required);
        }
    }

    double baseWeightComponent(double totalSourceWeight) {
        if (!Double.isFinite(totalSourceWeight) || totalSourceWeight <= 0.0) {
            return 0.0;
        }
        return Math.min(MAX_BASE_COMPONENT, totalSourceWeight);
    }

    double touchQualityComponent(List<TouchRecord> touches) {
        double averageRejection = touches.isEmpty()
                ? properties.scoring().neutralRejectionStrength().doubleValue()
                : touches.stream()
                        .mapToDouble(TouchRecord::rejectionStrength)
                        .filter(Double::isFinite)
                        .average()
                        .orElse(properties.scoring().neutralRejectionStrength().doubleValue());

        double scaled = clamp(averageRejection, 0.0, MAX_REJECTION_STRENGTH) / MAX_REJECTION_STRENGTH
                * MAX_TOUCH_QUALITY_COMPONENT;
        return scaled * touchCountFactor(touches.size());
    }

    /**
     * Two or three touches confirm a level. Fewer is unconfirmed and more means the level keeps getting
     * tested, which usually precedes a break.
     */
    double touchCountFactor(int touchCount) {
        if (touchCount <= 1) {
            return 0.8;
        }
        if (touchCount <= 3) {
            return 1.0;
        }
        if (touchCount <= 5) {
            return 0.9;
        }
        return 0.7;
    }

    double confluenceBonus(int confluenceCount) {
        if (confluenceCount >= 4) {
            return 1.5;
        }
        if (confluenceCount == 3) {
            return 1.0;
        }
        if (confluenceCount == 2) {
            return 0.5;
        }
        return 0.0;
    }

    /**
     * Orders zones strongest first; equal scores prefer the zone nearer to {@code price}.
     */
    public static Comparator<Zone> byStrengthThenProximity(double price) {
        return Comparator.comparingDouble(Zone::strengthScore).reversed()
                .thenComparingDouble(zone -> zone.distanceTo(price));
    }

    private double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public record ZoneStrength(
            double score,
            double baseComponent,
            double touchQualityComponent,
            double timeframeComponent,
            double confluenceBonus,
            boolean lowConfidence
    ) {
    }
}
