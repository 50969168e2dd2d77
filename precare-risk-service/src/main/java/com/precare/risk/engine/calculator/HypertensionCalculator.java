package com.precare.risk.engine.calculator;

import com.precare.risk.engine.FactorAttributor;
import com.precare.risk.model.Condition;
import com.precare.risk.model.PatientRecord;
import com.precare.risk.model.RiskResult;
import com.precare.risk.repository.ConditionCatalogRepository;
import com.precare.risk.repository.ConditionModelRegistry;
import com.precare.risk.repository.ConditionModelRegistry.ConditionModel;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

import static com.precare.risk.engine.ContributionEvaluator.*;
import static com.precare.risk.engine.FactorAttributor.factor;

@Component
public class HypertensionCalculator extends AbstractConditionCalculator {

    static final String MODEL = "hypertension";

    private static final FactorAttributor FACTORS = FactorAttributor.of(
            factor("Elevated blood pressure", r -> r.systolicBp() > 130),
            factor("Overweight BMI", r -> r.bmi() > 25),
            factor("Family history", PatientRecord::familyHypertension),
            factor("Age factor", r -> r.age() > 45)
    );

    private final double baseRisk;
    private final List<Term> terms;

    public HypertensionCalculator(ConditionModelRegistry models, ConditionCatalogRepository catalog) {
        super(Condition.HYPERTENSION, catalog);
        ConditionModel model = models.require(MODEL);
        this.baseRisk = model.baseRisk();
        this.terms = List.of(
                excessOver(PatientRecord::age, 45, model.weight("age_factor")),
                excessOver(PatientRecord::bmi, 25, model.weight("bmi_factor")),
                flat(PatientRecord::familyHypertension, model.weight("family_history_factor")),
                excessOver(PatientRecord::systolicBp, 120, model.weight("systolic_bp_factor"))
        );
    }

    @Override
    public RiskResult calculate(PatientRecord record, Map<Condition, RiskResult> upstream) {
        return publish(evaluate(baseRisk, record, terms), FACTORS.attribute(record));
    }
}
