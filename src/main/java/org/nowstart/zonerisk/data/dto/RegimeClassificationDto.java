package org.nowstart.zonerisk.data.dto;

import java.math.BigDecimal;
import org.nowstart.zonerisk.data.type.MarketCondition;
import org.nowstart.zonerisk.data.type.TrendDirection;

public record RegimeClassificationDto(
        MarketCondition condition,
        BigDecimal priceChange1h,
        BigDecimal volatility5m,
        TrendDirection trend
) {
}
