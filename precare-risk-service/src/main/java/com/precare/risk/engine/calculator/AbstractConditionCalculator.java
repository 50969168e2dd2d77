package com.precare.risk.engine.calculator;

import com.precare.risk.engine.RiskCategorizer;
import com.precare.risk.model.Condition;
import com.precare.risk.model.RiskResult;
import com.precare.risk.repository.ConditionCatalogRepository;

import java.util.List;
import java.util.Map;

abstract class AbstractConditionCalculator implements ConditionCalculator {

    private final Condition condition;
    protected final ConditionCatalogRepository catalog;

    protected AbstractConditionCalculator(Condition condition, ConditionCatalogRepository catalog) {
        this.condition = condition;
        this.catalog = catalog;
    }

    @Override
    public final Condition condition() {
        return condition;
    }

    /**
     * Converts an accumulated risk fraction into the published result, clamped to the
     * condition's cap.
     */
    protected RiskResult publish(double riskFraction, List<String> keyFactors) {
        double riskPercentage = Math.max(0, Math.min(riskFraction * 100, condition.riskCap()));
        return new RiskResult(
                riskPercentage,
                RiskCategorizer.categorize(riskPercentage),
                keyFactors,
                catalog.recommendationsFor(condition)
        );
    }

    protected static RiskResult requireUpstream(Map<Condition, RiskResult> upstream, Condition dependency) {
        RiskResult result = upstream == null ? null : upstream.get(dependency);
        if (result == null) {
            throw new IllegalStateException("Missing upstream result for " + dependency.id());
        }
        return result;
    }
}
