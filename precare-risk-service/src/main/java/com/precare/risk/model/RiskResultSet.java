package com.precare.risk.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One result per {@link Condition}, keyed by condition id in publication order.
 * Built fresh for every run and never mutated afterwards.
 */
public final class RiskResultSet {

    private final Map<Condition, RiskResult> results;

    private RiskResultSet(Map<Condition, RiskResult> results) {
        this.results = Collections.unmodifiableMap(new EnumMap<>(results));
    }

    /**
     * @throws IllegalArgumentException when any condition is missing
     */
    public static RiskResultSet of(Map<Condition, RiskResult> results) {
        for (Condition condition : Condition.values()) {
            if (results.get(condition) == null) {
                throw new IllegalArgumentException("Missing result for condition: " + condition.id());
            }
        }
        return new RiskResultSet(results);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static RiskResultSet fromJson(Map<String, RiskResult> byId) {
        Map<Condition, RiskResult> results = new EnumMap<>(Condition.class);
        byId.forEach((id, result) -> results.put(Condition.fromId(id), result));
        return of(results);
    }

    public RiskResult get(Condition condition) {
        return results.get(condition);
    }

    public Map<Condition, RiskResult> asMap() {
        return results;
    }

    @JsonValue
    Map<String, RiskResult> byId() {
        Map<String, RiskResult> byId = new LinkedHashMap<>();
        results.forEach((condition, result) -> byId.put(condition.id(), result));
        return byId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RiskResultSet other)) return false;
        return results.equals(other.results);
    }

    @Override
    public int hashCode() {
        return Objects.hash(results);
    }

    @Override
    public String toString() {
        return "RiskResultSet" + byId();
    }
}
