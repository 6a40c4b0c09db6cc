package org.nowstart.zonerisk.data.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import org.nowstart.zonerisk.zone.core.TouchRecord;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PersistedTouch(
        long timestamp,
        double touchPrice,
        double rejectionStrength,
        double volumeRatio
) {

    public static PersistedTouch from(TouchRecord touch) {
        return new PersistedTouch(
                touch.timestamp().toEpochMilli(),
                touch.touchPrice(),
                touch.rejectionStrength(),
                touch.volumeRatio()
        );
    }

    public TouchRecord toTouchRecord() {
        return new TouchRecord(Instant.ofEpochMilli(timestamp), touchPrice, rejectionStrength, volumeRatio);
    }
}
