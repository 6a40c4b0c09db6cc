package org.nowstart.zonerisk.data.type;

public enum SignalDirection {
    LONG,
    SHORT;

    public boolean isLong() {
        return this == LONG;
    }
}
