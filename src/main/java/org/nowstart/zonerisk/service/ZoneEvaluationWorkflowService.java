package org.nowstart.zonerisk.service;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.zonerisk.data.property.ZoneRiskProperties;
import org.nowstart.zonerisk.zone.StrengthScorer;
import org.nowstart.zonerisk.zone.ZoneClusteringEngine;
import org.nowstart.zonerisk.zone.core.Zone;
import org.nowstart.zonerisk.zone.core.ZoneCluster;
import org.nowstart.zonerisk.zone.core.ZoneSnapshot;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RefreshScope
@RequiredArgsConstructor
public class ZoneEvaluationWorkflowService {

    static final int STRONGEST_IN_REPORT = 3;

    private final ZoneRiskProperties properties;
    private final MarketDataService marketDataService;
    private final LevelCollectionService levelCollectionService;
    private final ZoneClusteringEngine zoneClusteringEngine;
    private final ZoneStateService zoneStateService;
    private final ZoneRiskLogService zoneRiskLogService;

    public List<CycleReport> runOnce() {
        List<String> markets = properties.markets().stream()
                .map(marketDataService::normalizeMarket)
                .filter(market -> !market.isBlank())
                .distinct()
                .toList();

        List<CycleReport> reports = new ArrayList<>();
        for (String market : markets) {
            try {
                reports.add(evaluate(market));
            } catch (Exception e) {
                log.error("Failed to evaluate zones for market={}", market, e);
            }
        }
        return reports;
    }

    public CycleReport evaluate(String symbol) {
        LevelCollectionService.CollectedLevels collected = levelCollectionService.collect(symbol);
        List<ZoneCluster> clusters = zoneClusteringEngine.cluster(collected.levels(), collected.atr());
        ZoneStateService.CycleUpdate update = zoneStateService.applyCycle(symbol, clusters, collected.atr()).join();

        ZoneSnapshot snapshot = update.snapshot();
        List<Zone> strongest = snapshot.zones().stream()
                .sorted(StrengthScorer.byStrengthThenProximity(collected.currentPrice()))
                .limit(STRONGEST_IN_REPORT)
                .toList();
        CycleReport report = new CycleReport(
                symbol,
                snapshot.version(),
                collected.currentPrice(),
                snapshot.atr(),
                collected.levels().size(),
                snapshot.zones().size(),
                update.result().matched(),
                update.result().created(),
                update.result().expired(),
                collected.failedSources(),
                strongest
        );
        zoneRiskLogService.logZoneCycle(report);
        return report;
    }

    public record CycleReport(
            String symbol,
            long snapshotVersion,
            double currentPrice,
            double atr,
            int levelCount,
            int zoneCount,
            int matched,
            int created,
            int expired,
            List<String> failedSources,
            List<Zone> strongest
    ) {
    }
}
