package org.nowstart.zonerisk.data.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import org.nowstart.zonerisk.data.type.TrendDirection;

public record RegimeClassifyRequest(
        @NotNull(message = "priceChange1h is required")
        BigDecimal priceChange1h,
        @NotNull(message = "volatility5m is required")
        @DecimalMin(value = "0", message = "volatility5m must not be negative")
        BigDecimal volatility5m,
        @NotNull(message = "trend is required")
        TrendDirection trend
) {
}
