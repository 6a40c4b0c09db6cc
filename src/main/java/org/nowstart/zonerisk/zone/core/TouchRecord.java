package org.nowstart.zonerisk.zone.core;

import java.time.Instant;

public record TouchRecord(
        Instant timestamp,
        double touchPrice,
        double rejectionStrength,
        double volumeRatio
) {
}
