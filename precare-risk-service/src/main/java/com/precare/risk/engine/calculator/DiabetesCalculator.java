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

/**
 * Type 2 diabetes. HbA1c is scored from 5.7 inclusive, so a value of exactly 5.7 fires the
 * term with a zero magnitude.
 */
@Component
public class DiabetesCalculator extends AbstractConditionCalculator {

    static final String MODEL = "diabetes";

    private static final FactorAttributor FACTORS = FactorAttributor.of(
            factor("Prediabetic HbA1c", r -> r.hba1c() >= 5.7),
            factor("Gestational diabetes history", PatientRecord::gestationalDiabetes),
            factor("Family history", PatientRecord::familyDiabetes),
            factor("BMI", r -> r.bmi() > 25)
    );

    private final double baseRisk;
    private final List<Term> terms;

    public DiabetesCalculator(ConditionModelRegistry models, ConditionCatalogRepository catalog) {
        super(Condition.DIABETES, catalog);
        ConditionModel model = models.require(MODEL);
        this.baseRisk = model.baseRisk();
        this.terms = List.of(
                excessOver(PatientRecord::age, 40, model.weight("age_factor")),
                // lower cut point than hypertension
                excessOver(PatientRecord::bmi, 23, model.weight("bmi_factor")),
                flat(PatientRecord::familyDiabetes, model.weight("family_history_factor")),
                flat(PatientRecord::gestationalDiabetes, model.weight("gestational_diabetes_factor")),
                excessFrom(PatientRecord::hba1c, 5.7, model.weight("hba1c_factor"))
        );
    }

    @Override
    public RiskResult calculate(PatientRecord record, Map<Condition, RiskResult> upstream) {
        return publish(evaluate(baseRisk, record, terms), FACTORS.attribute(record));
    }
}
