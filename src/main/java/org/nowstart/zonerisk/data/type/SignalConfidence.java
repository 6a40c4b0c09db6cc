package org.nowstart.zonerisk.data.type;

public enum SignalConfidence {
    HIGH,
    MEDIUM,
    LOW
}
