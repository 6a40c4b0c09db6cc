package org.nowstart.zonerisk.data.type;

public enum RiskDecisionStatus {
    ACCEPTED,
    REJECTED
}
