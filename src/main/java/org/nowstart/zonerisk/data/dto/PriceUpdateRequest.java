package org.nowstart.zonerisk.data.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Instant;
import org.nowstart.zonerisk.zone.core.OhlcvCandle;

/**
 * One pushed price update. Only {@code close} is required; a bare trade leaves open, high and low
 * empty and they default to the close.
 */
public record PriceUpdateRequest(
        Instant timestamp,
        @DecimalMin(value = "0", inclusive = false, message = "open must be greater than zero")
        BigDecimal open,
        @DecimalMin(value = "0", inclusive = false, message = "high must be greater than zero")
        BigDecimal high,
        @DecimalMin(value = "0", inclusive = false, message = "low must be greater than zero")
        BigDecimal low,
        @NotNull(message = "close is required")
        @DecimalMin(value = "0", inclusive = false, message = "close must be greater than zero")
        BigDecimal close,
        @DecimalMin(value = "0", message = "volume must not be negative")
        BigDecimal volume
) {

    public OhlcvCandle toCandle() {
        double closePrice = close.doubleValue();
        return new OhlcvCandle(
                timestamp == null ? Instant.now() : timestamp,
                open == null ? closePrice : open.doubleValue(),
                high == null ? closePrice : high.doubleValue(),
                low == null ? closePrice : low.doubleValue(),
                closePrice,
                volume == null ? 0.0 : volume.doubleValue()
        );
    }
}
