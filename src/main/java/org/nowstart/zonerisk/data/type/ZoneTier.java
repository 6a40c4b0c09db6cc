package org.nowstart.zonerisk.data.type;

public enum ZoneTier {
    MAJOR(2.0),
    INTERMEDIATE(1.5),
    MINOR(1.0);

    private final double timeframeWeight;

    ZoneTier(double timeframeWeight) {
        this.timeframeWeight = timeframeWeight;
    }

    public double timeframeWeight() {
        return timeframeWeight;
    }
}
