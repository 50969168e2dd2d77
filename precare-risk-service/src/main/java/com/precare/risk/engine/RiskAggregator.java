package com.precare.risk.engine;

import com.precare.risk.engine.calculator.ConditionCalculator;
import com.precare.risk.model.Condition;
import com.precare.risk.model.PatientRecord;
import com.precare.risk.model.RiskResult;
import com.precare.risk.model.RiskResultSet;
import com.precare.risk.validation.PatientRecordValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Runs every condition calculator in dependency order and assembles the result set.
 * <p>
 * The execution order is derived once from the dependencies each calculator declares.
 * Results are never cached between runs; within a run each dependent receives the exact
 * upstream results already computed.
 */
@Service
public class RiskAggregator {

    private static final Logger log = LoggerFactory.getLogger(RiskAggregator.class);

    private final PatientRecordValidator validator;
    private final List<ConditionCalculator> executionOrder;

    public RiskAggregator(List<ConditionCalculator> calculators, PatientRecordValidator validator) {
        this.validator = validator;
        this.executionOrder = orderByDependencies(calculators);
        log.debug("Risk calculator execution order: {}",
                executionOrder.stream().map(c -> c.condition().id()).toList());
    }

    public RiskResultSet calculateAllRisks(PatientRecord record) {
        validator.validate(record);

        Map<Condition, RiskResult> results = new EnumMap<>(Condition.class);
        for (ConditionCalculator calculator : executionOrder) {
            Map<Condition, RiskResult> upstream = new EnumMap<>(Condition.class);
            for (Condition dependency : calculator.dependencies()) {
                upstream.put(dependency, results.get(dependency));
            }
            RiskResult result = calculator.calculate(record, Collections.unmodifiableMap(upstream));
            log.debug("Patient {}: {} risk {}% ({})", record.id(), calculator.condition().id(),
                    result.riskPercentage(), result.riskLevel());
            results.put(calculator.condition(), result);
        }
        return RiskResultSet.of(results);
    }

    public List<Condition> executionOrder() {
        return executionOrder.stream().map(ConditionCalculator::condition).toList();
    }

    /**
     * Topological order over the declared dependencies. Among ready calculators the one whose
     * condition comes first in publication order runs first.
     *
     * @throws IllegalStateException on duplicate or missing calculators and on cycles
     */
    static List<ConditionCalculator> orderByDependencies(List<ConditionCalculator> calculators) {
        Map<Condition, ConditionCalculator> byCondition = new EnumMap<>(Condition.class);
        for (ConditionCalculator calculator : calculators) {
            ConditionCalculator previous = byCondition.put(calculator.condition(), calculator);
            if (previous != null) {
                throw new IllegalStateException("Duplicate calculator for " + calculator.condition().id());
            }
        }
        for (Condition condition : Condition.values()) {
            if (!byCondition.containsKey(condition)) {
                throw new IllegalStateException("No calculator registered for " + condition.id());
            }
        }
        for (ConditionCalculator calculator : byCondition.values()) {
            if (calculator.dependencies().contains(calculator.condition())) {
                throw new IllegalStateException("Calculator depends on itself: " + calculator.condition().id());
            }
        }

        List<ConditionCalculator> ordered = new ArrayList<>();
        Set<Condition> done = EnumSet.noneOf(Condition.class);
        while (ordered.size() < byCondition.size()) {
            ConditionCalculator next = byCondition.values().stream()
                    .filter(c -> !done.contains(c.condition()))
                    .filter(c -> done.containsAll(c.dependencies()))
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException(
                            "Cyclic calculator dependencies among " + remaining(byCondition, done)));
            ordered.add(next);
            done.add(next.condition());
        }
        return List.copyOf(ordered);
    }

    private static List<String> remaining(Map<Condition, ConditionCalculator> byCondition, Set<Condition> done) {
        return byCondition.keySet().stream()
                .filter(c -> !done.contains(c))
                .map(Condition::id)
                .toList();
    }
}
