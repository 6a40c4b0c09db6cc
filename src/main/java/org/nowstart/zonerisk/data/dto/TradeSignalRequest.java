package org.nowstart.zonerisk.data.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import org.nowstart.zonerisk.data.type.SignalConfidence;
import org.nowstart.zonerisk.data.type.SignalDirection;
import org.nowstart.zonerisk.risk.TradeSignal;

public record TradeSignalRequest(
        @NotNull(message = "direction is required")
        SignalDirection direction,
        @NotNull(message = "confidence is required")
        SignalConfidence confidence,
        @DecimalMin(value = "0", inclusive = false, message = "entryPrice must be greater than zero")
        BigDecimal entryPrice
) {

    public TradeSignal toSignal() {
        return new TradeSignal(direction, confidence, entryPrice == null ? null : entryPrice.doubleValue());
    }
}
