package org.nowstart.zonerisk.data.dto;

import java.time.Instant;
import java.util.List;
import org.nowstart.zonerisk.zone.core.ZoneSnapshot;

public record ZoneSnapshotDto(
        String symbol,
        long version,
        Instant capturedAt,
        Double atr,
        List<ZoneDto> zones
) {

    public static ZoneSnapshotDto from(ZoneSnapshot snapshot) {
        return new ZoneSnapshotDto(
                snapshot.symbol(),
                snapshot.version(),
                snapshot.capturedAt(),
                Double.isFinite(snapshot.atr()) ? snapshot.atr() : null,
                snapshot.zones().stream().map(ZoneDto::from).toList()
        );
    }
}
