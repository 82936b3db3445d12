package com.vidnyan.codesense.domain.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Three-level classification of a fused risk score.
 */
public enum RiskLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    public static final double HIGH_THRESHOLD = 0.7;
    public static final double MEDIUM_THRESHOLD = 0.4;

    private final String tag;

    RiskLevel(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    /**
     * Level for a score: high at 0.7 and above, medium at 0.4 and above, low otherwise.
     */
    public static RiskLevel of(double riskScore) {
        if (riskScore >= HIGH_THRESHOLD) {
            return HIGH;
        }
        if (riskScore >= MEDIUM_THRESHOLD) {
            return MEDIUM;
        }
        return LOW;
    }
}
