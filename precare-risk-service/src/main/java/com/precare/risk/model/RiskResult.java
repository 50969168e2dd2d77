package com.precare.risk.model;

import java.util.List;

/**
 * Published outcome of one condition calculator.
 *
 * @param riskPercentage  clamped to [0, cap] of the condition
 * @param riskLevel       band of {@code riskPercentage}
 * @param keyFactors      factors that fired, in declaration order
 * @param recommendations fixed per-condition list
 */
public record RiskResult(
        double riskPercentage,
        RiskLevel riskLevel,
        List<String> keyFactors,
        List<String> recommendations
) {
    public RiskResult {
        keyFactors = keyFactors == null ? List.of() : List.copyOf(keyFactors);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public double riskFraction() {
        return riskPercentage / 100;
    }
}
