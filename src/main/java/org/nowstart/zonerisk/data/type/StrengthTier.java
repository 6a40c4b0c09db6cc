package org.nowstart.zonerisk.data.type;

public enum StrengthTier {
    STRONG,
    MEDIUM,
    WEAK;

    public static final double STRONG_THRESHOLD = 7.5;
    public static final double MEDIUM_THRESHOLD = 5.0;

    public static StrengthTier of(double strengthScore) {
        if (strengthScore >= STRONG_THRESHOLD) {
            return STRONG;
        }
        if (strengthScore >= MEDIUM_THRESHOLD) {
            return MEDIUM;
        }
        return WEAK;
    }

    public boolean atLeastMedium() {
        return this == STRONG || this == MEDIUM;
    }
}
