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

@Component
public class StrokeCalculator extends AbstractConditionCalculator {

    private static final double BASE_RISK = 0.03;

    private static final List<Term> TERMS = List.of(
            excessOver(PatientRecord::age, 45, 0.015),
            firstOf(
                    flat(r -> r.systolicBp() > 140, 0.25),
                    flat(r -> r.systolicBp() > 120, 0.10)
            ),
            firstOf(
                    flat(r -> r.hba1c() >= 6.5, 0.20),
                    flat(r -> r.hba1c() >= 5.7, 0.10)
            ),
            flat(r -> r.ldlCholesterol() > 130, 0.08),
            flat(r -> r.isFemale() && r.age() > 45, 0.05)
    );

    private static final FactorAttributor FACTORS = FactorAttributor.of(
            factor("Blood pressure", r -> r.systolicBp() > 130),
            factor("Glucose control", r -> r.hba1c() >= 5.7),
            factor("Cholesterol", r -> r.ldlCholesterol() > 100),
            factor("Age", r -> r.age() > 45)
    );

    public StrokeCalculator(ConditionCatalogRepository catalog) {
        super(Condition.STROKE, catalog);
    }

    @Override
    public RiskResult calculate(PatientRecord record, Map<Condition, RiskResult> upstream) {
        return publish(evaluate(BASE_RISK, record, TERMS), FACTORS.attribute(record));
    }
}
