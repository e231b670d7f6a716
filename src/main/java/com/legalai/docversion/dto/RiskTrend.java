package com.legalai.docversion.dto;

public enum RiskTrend {
    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable");

    private final String value;

    RiskTrend(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static RiskTrend fromCumulativeChange(long cumulativeRiskScoreChange) {
        if (cumulativeRiskScoreChange > 0) {
            return INCREASING;
        }
        if (cumulativeRiskScoreChange < 0) {
            return DECREASING;
        }
        return STABLE;
    }
}
