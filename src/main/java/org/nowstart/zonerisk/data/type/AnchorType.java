package org.nowstart.zonerisk.data.type;

public enum AnchorType {
    SR_LEVEL,
    FALLBACK_PCT
}
