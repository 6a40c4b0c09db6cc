package org.nowstart.zonerisk.data.exception;

import lombok.Getter;

@Getter
public class InsufficientHistoryException extends ZoneRiskException {

    public static final String CODE = "insufficient_history";

    private final int touchCount;
    private final int requiredTouches;

    public InsufficientHistoryException(int touchCount, int requiredTouches) {
        super(CODE, "Zone has " + touchCount + " touches, " + requiredTouches + " required for a confident score");
        this.touchCount = touchCount;
        this.requiredTouches = requiredTouches;
    }
}
