package org.nowstart.zonerisk.data.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TouchHistoryDocument(
        int formatVersion,
        long savedAt,
        Map<String, Double> atrBySymbol,
        List<PersistedZone> zones
) {

    public static final int CURRENT_FORMAT = 1;

    public TouchHistoryDocument {
        atrBySymbol = atrBySymbol == null ? Map.of() : Map.copyOf(atrBySymbol);
        zones = zones == null ? List.of() : List.copyOf(zones);
    }
}
