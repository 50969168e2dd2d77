package com.precare.risk.engine.calculator;

import com.precare.risk.model.Condition;
import com.precare.risk.model.PatientRecord;
import com.precare.risk.model.RiskResult;
import com.precare.risk.repository.ConditionCatalogRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.precare.risk.engine.ContributionEvaluator.*;

/**
 * Chronic kidney disease, driven by the same run's diabetes and hypertension results.
 * Key factors are the fixed catalog list whatever fired.
 */
@Component
public class KidneyDiseaseCalculator extends AbstractConditionCalculator {

    private static final double BASE_RISK = 0.05;
    private static final double DIABETES_WEIGHT = 0.3;
    private static final double HYPERTENSION_WEIGHT = 0.2;

    private static final Term AGE = excessOver(PatientRecord::age, 50, 0.01);

    public KidneyDiseaseCalculator(ConditionCatalogRepository catalog) {
        super(Condition.KIDNEY_DISEASE, catalog);
    }

    @Override
    public Set<Condition> dependencies() {
        return Set.of(Condition.DIABETES, Condition.HYPERTENSION);
    }

    @Override
    public RiskResult calculate(PatientRecord record, Map<Condition, RiskResult> upstream) {
        double diabetesRisk = requireUpstream(upstream, Condition.DIABETES).riskFraction();
        double hypertensionRisk = requireUpstream(upstream, Condition.HYPERTENSION).riskFraction();

        List<Term> terms = List.of(
                always(diabetesRisk * DIABETES_WEIGHT),
                always(hypertensionRisk * HYPERTENSION_WEIGHT),
                AGE
        );
        return publish(evaluate(BASE_RISK, record, terms), catalog.keyFactorsFor(condition()));
    }
}
