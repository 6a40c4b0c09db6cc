package org.nowstart.zonerisk.data.type;

public enum MarketCondition {
    NORMAL,
    EXTREME_BULLISH,
    EXTREME_BEARISH,
    EXTREME_VOLATILE;

    public boolean isExtreme() {
        return this != NORMAL;
    }

    public boolean isAlignedWith(SignalDirection direction) {
        return (this == EXTREME_BULLISH && direction == SignalDirection.LONG)
                || (this == EXTREME_BEARISH && direction == SignalDirection.SHORT);
    }

    public boolean isCounterTo(SignalDirection direction) {
        return (this == EXTREME_BULLISH && direction == SignalDirection.SHORT)
                || (this == EXTREME_BEARISH && direction == SignalDirection.LONG);
    }
}
