package org.nowstart.zonerisk.service;

import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.zonerisk.data.exception.InvalidRiskBoundsException;
import org.nowstart.zonerisk.data.property.ZoneRiskProperties;
import org.nowstart.zonerisk.data.type.MarketCondition;
import org.nowstart.zonerisk.data.type.Timeframe;
import org.nowstart.zonerisk.regime.MarketRegimeClassifier;
import org.nowstart.zonerisk.regime.RegimeInputResolver;
import org.nowstart.zonerisk.regime.RegimeInputs;
import org.nowstart.zonerisk.risk.RiskDecision;
import org.nowstart.zonerisk.risk.RiskParameterCalculator;
import org.nowstart.zonerisk.risk.RiskParameters;
import org.nowstart.zonerisk.risk.TradeSignal;
import org.nowstart.zonerisk.zone.core.OhlcvCandle;
import org.nowstart.zonerisk.zone.core.ZoneSnapshot;
import org.springframework.stereotype.Service;

/**
 * Turns a trade signal into a {@link RiskDecision} against the latest published zones. When the zones
 * change while the parameters are being computed, the result is thrown away and computed again from
 * the newer snapshot; after too many attempts the signal is rejected as stale.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskEvaluationService {

    private final ZoneRiskProperties properties;
    private final MarketDataService marketDataService;
    private final ZoneStateService zoneStateService;
    private final RegimeInputResolver regimeInputResolver;
    private final MarketRegimeClassifier marketRegimeClassifier;
    private final RiskParameterCalculator riskParameterCalculator;
    private final ZoneRiskLogService zoneRiskLogService;

    public RiskDecision evaluate(String symbol, TradeSignal signal) {
        double entryPrice = resolveEntryPrice(symbol, signal);
        MarketCondition condition = marketRegimeClassifier.classify(resolveRegimeInputs(symbol));
        if (!Double.isFinite(entryPrice) || entryPrice <= 0.0) {
            return record(RiskDecision.rejected(
                    symbol, signal, condition, RiskDecision.NO_PRICE, "No entry price available", 0L, 0
            ));
        }

        int maxAttempts = properties.evaluation().maxEvaluationAttempts();
        long lastVersion = 0L;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            ZoneSnapshot snapshot = zoneStateService.snapshot(symbol);
            lastVersion = snapshot.version();
            RiskDecision decision = compute(symbol, signal, entryPrice, condition, snapshot, attempt);

            long currentVersion = zoneStateService.snapshot(symbol).version();
            if (currentVersion == snapshot.version()) {
                return record(decision);
            }
            log.info("event=risk_decision_discarded symbol={} snapshot_version={} current_version={} attempt={}",
                    symbol, snapshot.version(), currentVersion, attempt);
        }

        return record(RiskDecision.rejected(
                symbol,
                signal,
                condition,
                RiskDecision.STALE_SNAPSHOT,
                "Zone snapshot kept changing during evaluation",
                lastVersion,
                maxAttempts
        ));
    }

    private RiskDecision compute(
            String symbol,
            TradeSignal signal,
            double entryPrice,
            MarketCondition condition,
            ZoneSnapshot snapshot,
            int attempt
    ) {
        try {
            RiskParameters parameters = riskParameterCalculator.calculate(
                    signal.direction(),
                    entryPrice,
                    condition,
                    snapshot
            );
            return RiskDecision.accepted(symbol, signal, condition, parameters, snapshot.version(), attempt);
        } catch (InvalidRiskBoundsException e) {
            return RiskDecision.rejected(
                    symbol,
                    signal,
                    condition,
                    e.getCode(),
                    e.getMessage(),
                    snapshot.version(),
                    attempt
            );
        }
    }

    private double resolveEntryPrice(String symbol, TradeSignal signal) {
        if (signal.entryPrice() != null) {
            return signal.entryPrice();
        }
        return marketDataService.resolveLivePrice(symbol, Double.NaN);
    }

    private RegimeInputs resolveRegimeInputs(String symbol) {
        try {
            List<OhlcvCandle> candles = marketDataService.fetchCandles(
                    symbol,
                    Timeframe.M5,
                    properties.regime().candleCount()
            );
            return regimeInputResolver.resolve(candles);
        } catch (Exception e) {
            log.warn("event=regime_inputs_unavailable symbol={} reason={}", symbol, e.getMessage(), e);
            return RegimeInputs.flat();
        }
    }

    private RiskDecision record(RiskDecision decision) {
        zoneRiskLogService.logRiskDecision(decision);
        return decision;
    }
}
