package com.precare.risk.engine;

import com.precare.risk.model.RiskLevel;

/**
 * Maps a risk percentage to its band. Lower edges are inclusive.
 */
public final class RiskCategorizer {

    public static final double MODERATE_THRESHOLD = 30;
    public static final double HIGH_THRESHOLD = 60;

    public static RiskLevel categorize(double riskPercentage) {
        if (riskPercentage >= HIGH_THRESHOLD) return RiskLevel.HIGH;
        if (riskPercentage >= MODERATE_THRESHOLD) return RiskLevel.MODERATE;
        return RiskLevel.LOW;
    }

    private RiskCategorizer() {}
}
