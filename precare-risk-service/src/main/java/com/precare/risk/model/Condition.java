package com.precare.risk.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * The assessed conditions, in the order results are published.
 */
public enum Condition {

    HYPERTENSION("hypertension", 95),
    DIABETES("diabetes", 95),
    KIDNEY_DISEASE("kidney_disease", 80),
    STROKE("stroke", 90),
    HEART_DISEASE("heart_disease", 90);

    private final String id;
    private final double riskCap;

    Condition(String id, double riskCap) {
        this.id = id;
        this.riskCap = riskCap;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /** Upper bound of the published risk percentage. */
    public double riskCap() {
        return riskCap;
    }

    public static Condition fromId(String id) {
        return Arrays.stream(values())
                .filter(c -> c.id.equals(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown condition: " + id));
    }
}
