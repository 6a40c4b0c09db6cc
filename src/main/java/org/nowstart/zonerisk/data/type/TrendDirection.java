package org.nowstart.zonerisk.data.type;

public enum TrendDirection {
    BULLISH,
    BEARISH,
    NEUTRAL
}
