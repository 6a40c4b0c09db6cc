package org.nowstart.zonerisk.risk;

import org.nowstart.zonerisk.data.type.MarketCondition;
import org.nowstart.zonerisk.data.type.RiskDecisionStatus;

/**
 * Outcome of evaluating one trade signal against a zone snapshot. Rejected decisions carry a
 * machine-readable reason code and no parameters.
 */
public record RiskDecision(
        String symbol,
        RiskDecisionStatus status,
        String reasonCode,
        String message,
        TradeSignal signal,
        MarketCondition condition,
        RiskParameters parameters,
        long snapshotVersion,
        int attempts
) {

    public static final String STALE_SNAPSHOT = "STALE_SNAPSHOT";
    public static final String NO_PRICE = "NO_PRICE";

    public static RiskDecision accepted(
            String symbol,
            TradeSignal signal,
            MarketCondition condition,
            RiskParameters parameters,
            long snapshotVersion,
            int attempts
    ) {
        return new RiskDecision(
                symbol,
                RiskDecisionStatus.ACCEPTED,
                null,
                parameters.rationale().describe(),
                signal,
                condition,
                parameters,
                snapshotVersion,
                attempts
        );
    }

    public static RiskDecision rejected(
            String symbol,
            TradeSignal signal,
            MarketCondition condition,
            String reasonCode,
            String message,
            long snapshotVersion,
            int attempts
    ) {
        return new RiskDecision(
                symbol,
                RiskDecisionStatus.REJECTED,
                reasonCode,
                message,
                signal,
                condition,
                null,
                snapshotVersion,
                attempts
        );
    }

    public boolean isAccepted() {
        return status == RiskDecisionStatus.ACCEPTED;
    }
}
