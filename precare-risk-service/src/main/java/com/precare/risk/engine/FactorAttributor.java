package com.precare.risk.engine;

import com.precare.risk.model.PatientRecord;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

/**
 * Names the factors that fired for a record, in declaration order.
 * Cut points are declared per factor and may differ from the scoring thresholds.
 */
public final class FactorAttributor {

    public record Factor(String label, Predicate<PatientRecord> when) {}

    private final List<Factor> factors;

    private FactorAttributor(List<Factor> factors) {
        this.factors = List.copyOf(factors);
    }

    public static FactorAttributor of(Factor... factors) {
        return new FactorAttributor(Arrays.asList(factors));
    }

    public static Factor factor(String label, Predicate<PatientRecord> when) {
        return new Factor(label, when);
    }

    public List<String> attribute(PatientRecord record) {
        List<String> fired = new ArrayList<>();
        for (Factor factor : factors) {
            if (factor.when().test(record)) {
                fired.add(factor.label());
            }
        }
        return fired;
    }
}
