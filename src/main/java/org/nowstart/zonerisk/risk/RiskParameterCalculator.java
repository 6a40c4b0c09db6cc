package org.nowstart.zonerisk.risk;

import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.zonerisk.data.exception.InvalidRiskBoundsException;
import org.nowstart.zonerisk.data.property.ZoneRiskProperties;
import org.nowstart.zonerisk.data.type.AnchorType;
import org.nowstart.zonerisk.data.type.MarketCondition;
import org.nowstart.zonerisk.data.type.SignalDirection;
import org.nowstart.zonerisk.zone.core.Zone;
import org.nowstart.zonerisk.zone.core.ZoneSnapshot;
import org.springframework.stereotype.Component;

/**
 * Turns a signal, the current regime and the surrounding zones into stop-loss, take-profit and
 * position size. Pure: the result depends only on the arguments and configuration.
 */
@Component
@RequiredArgsConstructor
public class RiskParameterCalculator {

    private final ZoneRiskProperties properties;

    public RiskParameters calculate(
            SignalDirection direction,
            double entryPrice,
            MarketCondition condition,
            ZoneSnapshot snapshot
    ) {
        return calculate(
                direction,
                entryPrice,
                condition,
                snapshot.resistancesAbove(entryPrice),
                snapshot.supportsBelow(entryPrice)
        );
    }

    /**
     * @param resistances zones above entry, nearest first
     * @param supports    zones below entry, nearest first
     * @throws InvalidRiskBoundsException when the resulting risk/reward is below the regime minimum
     */
    public RiskParameters calculate(
            SignalDirection direction,
            double entryPrice,
            MarketCondition condition,
            List<Zone> resistances,
            List<Zone> supports
    ) {
        if (direction == null || condition == null) {
            throw new IllegalArgumentException("direction and condition are required");
        }
        if (!Double.isFinite(entryPrice) || entryPrice <= 0.0) {
            throw new IllegalArgumentException("entryPrice must be positive");
        }

        ZoneRiskProperties.Risk risk = properties.risk();
        double tpBufferPct = risk.tpBufferPct().doubleValue();
        double slBufferPct = risk.slBufferPct().doubleValue();
        double fallbackTpPct = risk.fallbackTpPct().doubleValue();
        double fallbackSlPct = risk.fallbackSlPct().doubleValue();
        double minSlPct = risk.minSlPct().doubleValue();
        double maxSlPct = risk.maxSlPct().doubleValue();
        double minTpPct = risk.minTpPct().doubleValue();
        double maxTpPct = risk.maxTpPct().doubleValue();
        double reducedPosition = risk.reducedPositionMultiplier().doubleValue();
        double minPosition = risk.minPositionMultiplier().doubleValue();
        double maxPosition = risk.maxPositionMultiplier().doubleValue();

        boolean aligned = condition.isAlignedWith(direction);
        boolean counterTrend = condition.isCounterTo(direction);
        boolean isLong = direction.isLong();

        List<Zone> targets = profitableSide(isLong ? resistances : supports, entryPrice, isLong);
        List<Zone> stops = profitableSide(isLong ? supports : resistances, entryPrice, !isLong);

        Zone tpZone = targets.isEmpty() ? null : selectTakeProfitZone(targets, aligned);
        Zone slZone = stops.isEmpty() ? null : stops.get(0);

        double tpMultiplier = 1.0;
        double slMultiplier = 1.0;
        double positionMultiplier = 1.0;
        if (counterTrend) {
            tpMultiplier = risk.counterTrendTpMultiplier().doubleValue();
            slMultiplier = risk.counterTrendSlMultiplier().doubleValue();
            positionMultiplier = reducedPosition;
        } else if (condition == MarketCondition.EXTREME_VOLATILE) {
            positionMultiplier = reducedPosition;
        }

        double tpDistance;
        if (tpZone == null) {
            double fallbackMultiplier = aligned ? risk.alignedTpMultiplier().doubleValue() : tpMultiplier;
            tpDistance = entryPrice * fallbackTpPct * fallbackMultiplier;
        } else {
            double buffered = isLong
                    ? tpZone.priceCenter() * (1.0 - tpBufferPct)
                    : tpZone.priceCenter() * (1.0 + tpBufferPct);
            tpDistance = Math.abs(buffered - entryPrice) * tpMultiplier;
        }

        double slDistance;
        if (slZone == null) {
            slDistance = entryPrice * fallbackSlPct * slMultiplier;
        } else {
            double buffered = isLong
                    ? slZone.priceCenter() * (1.0 - slBufferPct)
                    : slZone.priceCenter() * (1.0 + slBufferPct);
            slDistance = Math.abs(entryPrice - buffered) * slMultiplier;
        }

        double clampedTp = clamp(tpDistance, entryPrice * minTpPct, entryPrice * maxTpPct);
        double clampedSl = clamp(slDistance, entryPrice * minSlPct, entryPrice * maxSlPct);
        double positionCap = counterTrend ? Math.min(maxPosition, reducedPosition) : maxPosition;
        double clampedPosition = clamp(positionMultiplier, minPosition, positionCap);

        double riskReward = clampedTp / clampedSl;
        double required = aligned
                ? risk.minRiskRewardAligned().doubleValue()
                : risk.minRiskRewardNormal().doubleValue();
        if (riskReward < required) {
            throw new InvalidRiskBoundsException(riskReward, required);
        }

        double tpPrice = isLong ? entryPrice + clampedTp : entryPrice - clampedTp;
        double slPrice = isLong ? entryPrice - clampedSl : entryPrice + clampedSl;

        RiskRationale rationale = new RiskRationale(
                condition,
                aligned,
                counterTrend,
                tpZone == null ? null : tpZone.id(),
                slZone == null ? null : slZone.id(),
                tpZone == null && aligned ? risk.alignedTpMultiplier().doubleValue() : tpMultiplier,
                slMultiplier,
                clampedPosition,
                clampedTp != tpDistance,
                clampedSl != slDistance,
                clampedPosition != positionMultiplier
        );

        return new RiskParameters(
                entryPrice,
                slPrice,
                tpPrice,
                slZone == null ? AnchorType.FALLBACK_PCT : AnchorType.SR_LEVEL,
                tpZone == null ? AnchorType.FALLBACK_PCT : AnchorType.SR_LEVEL,
                clampedPosition,
                tpZone,
                riskReward,
                rationale
        );
    }

    /**
     * Trend-aligned extremes reach past the nearest zone for the first MEDIUM or STRONG one, then the
     * second nearest, then the only one. Everything else takes the nearest.
     */
    Zone selectTakeProfitZone(List<Zone> targets, boolean trendAligned) {
        if (!trendAligned || targets.size() == 1) {
            return targets.get(0);
        }
        return targets.stream()
                .skip(1)
                .filter(zone -> zone.strengthTier().atLeastMedium())
                .findFirst()
                .orElse(targets.get(1));
    }

    private List<Zone> profitableSide(List<Zone> zones, double entryPrice, boolean above) {
        if (zones == null || zones.isEmpty()) {
            return List.of();
        }
        return zones.stream()
                .filter(zone -> zone != null && Double.isFinite(zone.priceCenter()))
                .filter(zone -> above ? zone.priceCenter() > entryPrice : zone.priceCenter() < entryPrice)
                .sorted(Comparator.comparingDouble(zone -> zone.distanceTo(entryPrice)))
                .toList();
    }

    private double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
