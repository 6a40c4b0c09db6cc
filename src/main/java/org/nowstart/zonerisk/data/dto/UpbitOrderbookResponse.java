package org.nowstart.zonerisk.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record UpbitOrderbookResponse(
        String market,
        Long timestamp,
        BigDecimal total_ask_size,
        BigDecimal total_bid_size,
        List<Unit> orderbook_units
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Unit(
            BigDecimal ask_price,
            BigDecimal bid_price,
            BigDecimal ask_size,
            BigDecimal bid_size
    ) {
    }
}
