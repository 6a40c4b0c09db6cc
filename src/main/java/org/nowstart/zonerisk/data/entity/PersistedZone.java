package org.nowstart.zonerisk.data.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import org.nowstart.zonerisk.data.type.Timeframe;
import org.nowstart.zonerisk.data.type.ZoneTier;

/**
 * Durable form of one zone, keyed by symbol, primary timeframe and log-scale price bucket.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PersistedZone(
        String symbol,
        Timeframe timeframe,
        long priceBucket,
        double priceCenter,
        double mergeRadius,
        ZoneTier tier,
        double totalWeight,
        int confluenceCount,
        List<PersistedTouch> touches
) {

    public PersistedZone {
        touches = touches == null ? List.of() : List.copyOf(touches);
    }

    public String key() {
        return symbol + "|" + (timeframe == null ? "-" : timeframe.label()) + "|" + priceBucket;
    }
}
