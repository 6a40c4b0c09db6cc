package org.nowstart.zonerisk.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.nowstart.zonerisk.zone.StrengthScorer;
import org.nowstart.zonerisk.zone.core.Zone;
import org.nowstart.zonerisk.zone.core.ZoneSnapshot;
import org.springframework.stereotype.Service;

/**
 * Human-readable summary of the zones around the current price.
 */
@Service
@RequiredArgsConstructor
public class ZoneReportService {

    static final int ZONES_PER_SIDE = 3;

    private final MarketDataService marketDataService;
    private final ZoneStateService zoneStateService;

    public ZoneReport report(String symbol) {
        ZoneSnapshot snapshot = zoneStateService.snapshot(symbol);
        double price = marketDataService.resolveLivePrice(symbol, Double.NaN);
        return build(snapshot, price);
    }

    ZoneReport build(ZoneSnapshot snapshot, double price) {
        if (!Double.isFinite(price) || price <= 0.0) {
            return new ZoneReport(snapshot.symbol(), snapshot.version(), price, null, null,
                    List.of("No price available for " + snapshot.symbol()));
        }

        List<Zone> resistances = snapshot.resistancesAbove(price).stream().limit(ZONES_PER_SIDE).toList();
        List<Zone> supports = snapshot.supportsBelow(price).stream().limit(ZONES_PER_SIDE).toList();

        List<String> lines = new ArrayList<>();
        lines.add(String.format(Locale.ROOT, "%s price=%,.2f zones=%d version=%d",
                snapshot.symbol(), price, snapshot.zones().size(), snapshot.version()));
        resistances.forEach(zone -> lines.add(describe("Resistance", zone, price)));
        supports.forEach(zone -> lines.add(describe("Support", zone, price)));
        snapshot.zones().stream()
                .sorted(StrengthScorer.byStrengthThenProximity(price))
                .findFirst()
                .ifPresent(zone -> lines.add(describe("Strongest", zone, price)));

        return new ZoneReport(
                snapshot.symbol(),
                snapshot.version(),
                price,
                supports.isEmpty() ? null : supports.get(0),
                resistances.isEmpty() ? null : resistances.get(0),
                lines
        );
    }

    private String describe(String label, Zone zone, double price) {
        return String.format(
                Locale.ROOT,
                "%s %,.2f (%+.2f%%) %s %.1f/10 tier=%s touches=%d sources=%s%s",
                label,
                zone.priceCenter(),
                (zone.priceCenter() / price - 1.0) * 100.0,
                zone.strengthTier(),
                zone.strengthScore(),
                zone.tier(),
                zone.touchCount(),
                String.join(",", zone.sourceTags()),
                zone.lowConfidence() ? " low-confidence" : ""
        );
    }

    public record ZoneReport(
            String symbol,
            long snapshotVersion,
            double price,
            Zone nearestSupport,
            Zone nearestResistance,
            List<String> lines
    ) {
    }
}
