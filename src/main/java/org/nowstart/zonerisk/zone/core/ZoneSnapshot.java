package org.nowstart.zonerisk.zone.core;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Consistent, immutable copy of one symbol's zone state. The version increases every time the zone
 * state writer changes zones or touch history, which lets readers detect that a snapshot they are
 * working from has been superseded.
 */
public record ZoneSnapshot(
        String symbol,
        long version,
        Instant capturedAt,
        double atr,
        List<Zone> zones
) {

    public ZoneSnapshot {
        zones = zones == null ? List.of() : List.copyOf(zones);
    }

    public static ZoneSnapshot empty(String symbol) {
        return new ZoneSnapshot(symbol, 0L, Instant.EPOCH, Double.NaN, List.of());
    }

    public List<Zone> resistancesAbove(double price) {
        return zones.stream()
                .filter(zone -> zone.priceCenter() > price)
                .sorted(Comparator.comparingDouble(Zone::priceCenter))
                .toList();
    }

    public List<Zone> supportsBelow(double price) {
        return zones.stream()
                .filter(zone -> zone.priceCenter() < price)
                .sorted(Comparator.comparingDouble(Zone::priceCenter).reversed())
                .toList();
    }
}
