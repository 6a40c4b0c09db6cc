package org.nowstart.zonerisk.data.dto;

import java.util.List;
import org.nowstart.zonerisk.zone.TouchHistoryTracker;

public record PriceUpdateResultDto(
        String symbol,
        long snapshotVersion,
        List<TouchHistoryTracker.RecordedTouch> recordedTouches
) {
}
