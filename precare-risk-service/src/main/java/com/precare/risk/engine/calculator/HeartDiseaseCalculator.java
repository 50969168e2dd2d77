package com.precare.risk.engine.calculator;

import com.precare.risk.engine.FactorAttributor;
import com.precare.risk.model.Condition;
import com.precare.risk.model.PatientRecord;
import com.precare.risk.model.RiskResult;
import com.precare.risk.repository.ConditionCatalogRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

import static com.precare.risk.engine.ContributionEvaluator.*;
import static com.precare.risk.engine.FactorAttributor.factor;

/**
 * Ischemic heart disease. The age term is selected by gender: women from 45 at 0.012,
 * everyone else from 35 at 0.015.
 */
@Component
public class HeartDiseaseCalculator extends AbstractConditionCalculator {

    private static final double BASE_RISK = 0.04;

    private static final List<Term> TERMS = List.of(
            branch(PatientRecord::isFemale,
                    excessOver(PatientRecord::age, 45, 0.012),
                    excessOver(PatientRecord::age, 35, 0.015)),
            firstOf(
                    flat(r -> r.totalHdlRatio() > 5, 0.15),
                    flat(r -> r.totalHdlRatio() > 4, 0.08)
            ),
            firstOf(
                    flat(r -> r.systolicBp() > 140, 0.20),
                    flat(r -> r.systolicBp() > 130, 0.10)
            ),
            firstOf(
                    flat(r -> r.hba1c() >= 6.5, 0.25),
                    flat(r -> r.hba1c() >= 5.7, 0.12)
            )
    );

    private static final FactorAttributor FACTORS = FactorAttributor.of(
            factor("Cholesterol ratio", r -> r.totalHdlRatio() > 4),
            factor("Blood pressure", r -> r.systolicBp() > 130),
            factor("Glucose levels", r -> r.hba1c() >= 5.7)
    );

    public HeartDiseaseCalculator(ConditionCatalogRepository catalog) {
        super(Condition.HEART_DISEASE, catalog);
    }

    @Override
    public RiskResult calculate(PatientRecord record, Map<Condition, RiskResult> upstream) {
        return publish(evaluate(BASE_RISK, record, TERMS), FACTORS.attribute(record));
    }
}
