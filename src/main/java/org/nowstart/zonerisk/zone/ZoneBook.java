package org.nowstart.zonerisk.zone;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import lombok.Getter;
import org.nowstart.zonerisk.zone.core.Zone;
import org.nowstart.zonerisk.zone.core.ZoneCluster;
import org.nowstart.zonerisk.zone.core.ZoneSeed;
import org.nowstart.zonerisk.zone.core.ZoneSnapshot;

/**
 * All mutable zone state of one symbol: tracked zones with their touch history, the ATR of the last
 * evaluation cycle and the rolling volume window used for volume-spike scoring.
 *
 * <p>Not thread-safe. Every instance is confined to the zone state writer thread.
 */
public class ZoneBook {

    @Getter
    private final String symbol;
    private final int historyWindow;
    private final int volumeLookback;
    private final List<TrackedZone> zones = new ArrayList<>();
    private final Deque<Double> recentVolumes = new ArrayDeque<>();
    private long nextId = 1L;
    @Getter
    private double atr = Double.NaN;

    public ZoneBook(String symbol, int historyWindow, int volumeLookback) {
        this.symbol = symbol;
        this.historyWindow = historyWindow;
        this.volumeLookback = volumeLookback;
    }

    /**
     * Matches this cycle's clusters against known zones. Each cluster takes over the nearest known zone
     * whose center lies within the cluster's merge radius (closest pairs first, one-to-one), keeping its
     * id and touch history. Known zones left unmatched count a missed cycle and are dropped once they
     * reach {@code graceCycles}; clusters left unmatched start new zones with empty history.
     */
    public ReconcileResult reconcile(List<ZoneCluster> clusters, double cycleAtr, int graceCycles) {
        if (Double.isFinite(cycleAtr) && cycleAtr > 0.0) {
            this.atr = cycleAtr;
        }

        List<Candidate> candidates = new ArrayList<>();
        for (int c = 0; c < clusters.size(); c++) {
            ZoneCluster cluster = clusters.get(c);
            for (TrackedZone zone : zones) {
                double distance = Math.abs(zone.getPriceCenter() - cluster.priceCenter());
                if (distance <= cluster.mergeRadius()) {
                    candidates.add(new Candidate(c, zone, distance));
                }
            }
        }
        candidates.sort(Comparator.comparingDouble(Candidate::distance));

        boolean[] clusterMatched = new boolean[clusters.size()];
        List<TrackedZone> matchedZones = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (clusterMatched[candidate.clusterIndex()] || matchedZones.contains(candidate.zone())) {
                continue;
            }
            candidate.zone().updateFrom(clusters.get(candidate.clusterIndex()));
            clusterMatched[candidate.clusterIndex()] = true;
            matchedZones.add(candidate.zone());
        }

        int expired = 0;
        Iterator<TrackedZone> iterator = zones.iterator();
        while (iterator.hasNext()) {
            TrackedZone zone = iterator.next();
            if (matchedZones.contains(zone)) {
                continue;
            }
            if (zone.markMissed() >= graceCycles) {
                iterator.remove();
                expired++;
            }
        }

        int created = 0;
        for (int c = 0; c < clusters.size(); c++) {
            if (!clusterMatched[c]) {
                zones.add(new TrackedZone(nextId++, clusters.get(c)));
                created++;
            }
        }
        zones.sort(Comparator.comparingDouble(TrackedZone::getPriceCenter));

        return new ReconcileResult(matchedZones.size(), created, expired);
    }

    public void restore(List<ZoneSeed> seeds, double restoredAtr) {
        for (ZoneSeed seed : seeds) {
            zones.add(new TrackedZone(nextId++, seed, historyWindow));
        }
        zones.sort(Comparator.comparingDouble(TrackedZone::getPriceCenter));
        if (Double.isFinite(restoredAtr) && restoredAtr > 0.0) {
            this.atr = restoredAtr;
        }
    }

    public ZoneSnapshot toSnapshot(long version, Instant capturedAt, StrengthScorer scorer) {
        List<Zone> published = zones.stream()
                .map(zone -> toZone(zone, scorer))
                .toList();
        return new ZoneSnapshot(symbol, version, capturedAt, atr, published);
    }

    public int size() {
        return zones.size();
    }

    List<TrackedZone> trackedZones() {
        return zones;
    }

    int historyWindow() {
        return historyWindow;
    }

    double averageVolume() {
        return recentVolumes.stream()
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(Double.NaN);
    }

    void recordVolume(double volume) {
        if (!Double.isFinite(volume) || volume < 0.0) {
            return;
        }
        recentVolumes.addLast(volume);
        while (recentVolumes.size() > volumeLookback) {
            recentVolumes.removeFirst();
        }
    }

    private Zone toZone(TrackedZone zone, StrengthScorer scorer) {
        StrengthScorer.ZoneStrength strength = scorer.score(
                zone.getTotalWeight(),
                zone.getTier(),
                zone.getConfluenceCount(),
                zone.touchHistory()
        );
        return new Zone(
                zone.getId(),
                zone.getPriceCenter(),
                zone.getMergeRadius(),
                zone.getMembers(),
                zone.getTier(),
                zone.getPrimaryTimeframe(),
                strength.score(),
                zone.getConfluenceCount(),
                zone.touchHistory(),
                strength.lowConfidence(),
                zone.getMissedCycles(),
                zone.getTotalWeight()
        );
    }

    private record Candidate(int clusterIndex, TrackedZone zone, double distance) {
    }

    public record ReconcileResult(int matched, int created, int expired) {
    }
}
