package org.nowstart.zonerisk.data.exception;

import java.util.Locale;
import lombok.Getter;

@Getter
public class InvalidRiskBoundsException extends ZoneRiskException {

    public static final String RR_BELOW_MINIMUM = "RR_BELOW_MINIMUM";

    private final double riskReward;
    private final double requiredRiskReward;

    public InvalidRiskBoundsException(double riskReward, double requiredRiskReward) {
        super(
                RR_BELOW_MINIMUM,
                String.format(Locale.ROOT, "Risk/reward %.2f is below required minimum %.2f", riskReward, requiredRiskReward)
        );
        this.riskReward = riskReward;
        this.requiredRiskReward = requiredRiskReward;
    }
}
