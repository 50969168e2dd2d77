package com.precare.risk.engine.calculator;

import com.precare.risk.model.Condition;
import com.precare.risk.model.PatientRecord;
import com.precare.risk.model.RiskResult;

import java.util.Map;
import java.util.Set;

/**
 * Scores one condition. Implementations are stateless; a calculator that consumes other
 * conditions' results declares them in {@link #dependencies()} and receives them, already
 * computed for the same record, through {@code upstream}.
 */
public interface ConditionCalculator {

    Condition condition();

    default Set<Condition> dependencies() {
        return Set.of();
    }

    RiskResult calculate(PatientRecord record, Map<Condition, RiskResult> upstream);
}
