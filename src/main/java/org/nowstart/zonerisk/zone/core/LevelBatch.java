package org.nowstart.zonerisk.zone.core;

import java.util.List;
import org.nowstart.zonerisk.data.type.Timeframe;

public record LevelBatch(
        String sourceTag,
        Timeframe timeframe,
        List<RawLevel> levels,
        double atr
) {

    public LevelBatch {
        levels = levels == null ? List.of() : List.copyOf(levels);
    }

    public static LevelBatch empty(String sourceTag, Timeframe timeframe) {
        return new LevelBatch(sourceTag, timeframe, List.of(), Double.NaN);
    }

    public boolean isEmpty() {
        return levels.isEmpty();
    }
}
