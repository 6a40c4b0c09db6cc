package org.nowstart.zonerisk.risk;

import org.nowstart.zonerisk.data.type.SignalConfidence;
import org.nowstart.zonerisk.data.type.SignalDirection;

/**
 * Trade intent handed over by the upstream decision agent. {@code entryPrice} may be null, in which
 * case the latest observed price is used.
 */
public record TradeSignal(
        SignalDirection direction,
        SignalConfidence confidence,
        Double entryPrice
) {
}
