package org.nowstart.zonerisk.service;

import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.zonerisk.risk.RiskDecision;
import org.nowstart.zonerisk.risk.RiskParameters;
import org.nowstart.zonerisk.zone.core.Zone;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class ZoneRiskLogService {

    public void logZoneCycle(ZoneEvaluationWorkflowService.CycleReport report) {
        log.info(
                "event=zone_cycle symbol={} version={} price={} atr={} levels={} zones={} matched={} created={} expired={} failed_sources={} strongest={}",
                report.symbol(),
                report.snapshotVersion(),
                sanitizeMetricForLog(report.currentPrice()),
                sanitizeMetricForLog(report.atr()),
                report.levelCount(),
                report.zoneCount(),
                report.matched(),
                report.created(),
                report.expired(),
                String.join(",", report.failedSources()),
                report.strongest().stream()
                        .map(this::formatZone)
                        .collect(Collectors.joining(", ", "[", "]"))
        );
    }

    public void logRiskDecision(RiskDecision decision) {
        RiskParameters parameters = decision.parameters();
        if (parameters == null) {
            log.info(
                    "event=risk_decision symbol={} status={} reason_code={} direction={} confidence={} condition={} snapshot_version={} attempts={} message=\"{}\"",
                    decision.symbol(),
                    decision.status(),
                    decision.reasonCode(),
                    decision.signal().direction(),
                    decision.signal().confidence(),
                    decision.condition(),
                    decision.snapshotVersion(),
                    decision.attempts(),
                    escape(decision.message())
            );
            return;
        }

        log.info(
                "event=risk_decision symbol={} status={} direction={} confidence={} condition={} entry={} sl={} tp={} sl_type={} tp_type={} position_multiplier={} rr={} reference_zone={} snapshot_version={} attempts={} rationale=\"{}\"",
                decision.symbol(),
                decision.status(),
                decision.signal().direction(),
                decision.signal().confidence(),
                decision.condition(),
                sanitizeMetricForLog(parameters.entryPrice()),
                sanitizeMetricForLog(parameters.slPrice()),
                sanitizeMetricForLog(parameters.tpPrice()),
                parameters.slType(),
                parameters.tpType(),
                sanitizeMetricForLog(parameters.positionMultiplier()),
                sanitizeMetricForLog(parameters.riskReward()),
                parameters.referenceZone() == null ? "none" : formatZone(parameters.referenceZone()),
                decision.snapshotVersion(),
                decision.attempts(),
                escape(parameters.rationale().describe())
        );
    }

    private String formatZone(Zone zone) {
        return "#" + zone.id()
                + "@" + sanitizeMetricForLog(zone.priceCenter())
                + ":" + zone.strengthTier()
                + "(" + sanitizeMetricForLog(zone.strengthScore()) + ")";
    }

    private String escape(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    double sanitizeMetricForLog(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return value == -0.0 ? 0.0 : value;
    }
}
