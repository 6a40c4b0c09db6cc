package org.nowstart.zonerisk.zone;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.nowstart.zonerisk.data.property.ZoneRiskProperties;
import org.nowstart.zonerisk.data.type.Timeframe;
import org.nowstart.zonerisk.zone.core.RawLevel;
import org.nowstart.zonerisk.zone.core.ZoneCluster;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ZoneClusteringEngine {

    private final ZoneRiskProperties properties;

    /**
     * Merges raw levels into zones. Levels are walked in ascending price order and join the current
     * cluster while they stay within the merge radius of its running weighted center. Adjacent clusters
     * whose centers still end up closer than the radius are folded together afterwards, so the returned
     * centers are ascending and at least one radius apart.
     */
    public List<ZoneCluster> cluster(List<RawLevel> levels, double atr) {
        if (levels == null || levels.isEmpty()) {
            return List.of();
        }

        List<RawLevel> usable = levels.stream()
                .filter(level -> level != null && level.isUsable())
                .sorted(Comparator.comparingDouble(RawLevel::price))
                .toList();
        if (usable.isEmpty()) {
            return List.of();
        }

        double radius = resolveMergeRadius(atr, usable);
        List<ClusterAccumulator> clusters = new ArrayList<>();
        ClusterAccumulator current = new ClusterAccumulator(usable.get(0));
        for (int i = 1; i < usable.size(); i++) {
            RawLevel level = usable.get(i);
            if (Math.abs(level.price() - current.center()) <= radius) {
                current.add(level);
                continue;
            }
            clusters.add(current);
            current = new ClusterAccumulator(level);
        }
        clusters.add(current);

        foldCloseNeighbours(clusters, radius);

        return clusters.stream()
                .map(cluster -> cluster.toZoneCluster(radius))
                .toList();
    }

    public double resolveMergeRadius(double atr, List<RawLevel> levels) {
        if (Double.isFinite(atr) && atr > 0.0) {
            return atr * properties.clustering().mergeAtrMultiplier().doubleValue();
        }
        double[] prices = levels.stream().mapToDouble(RawLevel::price).sorted().toArray();
        double median = prices.length == 0 ? 0.0 : prices[prices.length / 2];
        return median * properties.clustering().fallbackRadiusPct().doubleValue();
    }

    private void foldCloseNeighbours(List<ClusterAccumulator> clusters, double radius) {
        boolean merged = true;
        while (merged && clusters.size() > 1) {
            merged = false;
            for (int i = 0; i < clusters.size() - 1; i++) {
                ClusterAccumulator left = clusters.get(i);
                ClusterAccumulator right = clusters.get(i + 1);
                if (right.center() - left.center() < radius) {
                    left.absorb(right);
                    clusters.remove(i + 1);
                    merged = true;
                    break;
                }
            }
        }
    }

    private static final class ClusterAccumulator {

        private final List<RawLevel> members = new ArrayList<>();
        private double weightSum;
        private double weightedPriceSum;
        private double priceSum;

        private ClusterAccumulator(RawLevel first) {
            add(first);
        }

        private void add(RawLevel level) {
            members.add(level);
            weightSum += level.sourceWeight();
            weightedPriceSum += level.sourceWeight() * level.price();
            priceSum += level.price();
        }

        private void absorb(ClusterAccumulator other) {
            other.members.forEach(this::add);
        }

        private double center() {
            if (weightSum > 0.0) {
                return weightedPriceSum / weightSum;
            }
            return priceSum / members.size();
        }

        private ZoneCluster toZoneCluster(double radius) {
            Set<Timeframe> timeframes = EnumSet.noneOf(Timeframe.class);
            for (RawLevel member : members) {
                timeframes.add(member.timeframe());
            }
            Timeframe primary = timeframes.stream()
                    .max(Comparator.naturalOrder())
                    .orElseThrow();

            List<RawLevel> sorted = members.stream()
                    .sorted(Comparator.comparingDouble(RawLevel::price))
                    .toList();
            return new ZoneCluster(center(), radius, sorted, timeframes.size(), primary, primary.tier(), weightSum);
        }
    }
}
