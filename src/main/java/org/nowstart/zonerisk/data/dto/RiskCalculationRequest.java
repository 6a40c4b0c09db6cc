package org.nowstart.zonerisk.data.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.List;
import org.nowstart.zonerisk.data.type.MarketCondition;
import org.nowstart.zonerisk.data.type.SignalDirection;

public record RiskCalculationRequest(
        @NotNull(message = "direction is required")
        SignalDirection direction,
        @NotNull(message = "entryPrice is required")
        @DecimalMin(value = "0", inclusive = false, message = "entryPrice must be greater than zero")
        BigDecimal entryPrice,
        @NotNull(message = "condition is required")
        MarketCondition condition,
        List<@Valid ZoneLevel> zones
) {

    public record ZoneLevel(
            @NotNull(message = "zone price is required")
            @DecimalMin(value = "0", inclusive = false, message = "zone price must be greater than zero")
            BigDecimal price,
            @NotNull(message = "zone strengthScore is required")
            @DecimalMin(value = "0", message = "zone strengthScore must be between 0 and 10")
            @DecimalMax(value = "10", message = "zone strengthScore must be between 0 and 10")
            BigDecimal strengthScore
    ) {
    }
}
