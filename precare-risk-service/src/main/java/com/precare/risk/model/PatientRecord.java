package com.precare.risk.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.precare.risk.exception.InvalidRecordFieldException;
import lombok.Builder;

/**
 * Validated input of one assessment run.
 * <p>
 * Lifestyle fields (smoking, alcohol, exercise, diet), depression history, heart rate,
 * fasting glucose and family cancer history are carried through but no scoring formula
 * reads them.
 */
@Builder(toBuilder = true)
public record PatientRecord(
        String id,
        String name,

        int age,
        Gender gender,
        double heightCm,
        double weightKg,

        Smoking smoking,
        Alcohol alcohol,
        Exercise exercise,
        Diet diet,

        boolean gestationalDiabetes,
        boolean depressionHistory,

        boolean familyDiabetes,
        boolean familyHypertension,
        FamilyCancer familyCancer,

        int systolicBp,
        int diastolicBp,
        int heartRate,

        double fastingGlucose,
        double hba1c,
        double totalCholesterol,
        double ldlCholesterol,
        double hdlCholesterol
) {

    /**
     * Body mass index, weight over squared height in metres. Every calculator reads it
     * through this method so a run sees exactly one value.
     */
    public double bmi() {
        double heightM = heightCm / 100;
        return weightKg / (heightM * heightM);
    }

    /**
     * Total over HDL cholesterol.
     *
     * @throws InvalidRecordFieldException when HDL is not positive
     */
    public double totalHdlRatio() {
        if (!(hdlCholesterol > 0)) {
            throw new InvalidRecordFieldException("hdlCholesterol",
                    "must be greater than zero to compute the total/HDL ratio, was " + hdlCholesterol);
        }
        return totalCholesterol / hdlCholesterol;
    }

    @JsonIgnore
    public boolean isFemale() {
        return gender == Gender.FEMALE;
    }

    public enum Gender {
        @JsonProperty("Female") FEMALE,
        @JsonProperty("Male") MALE,
        @JsonProperty("Other") OTHER
    }

    public enum Smoking {
        @JsonProperty("Never") NEVER,
        @JsonProperty("Former") FORMER,
        @JsonProperty("Current") CURRENT
    }

    public enum Alcohol {
        @JsonProperty("None") NONE,
        @JsonProperty("Occasional") OCCASIONAL,
        @JsonProperty("Moderate") MODERATE,
        @JsonProperty("Heavy") HEAVY
    }

    public enum Exercise {
        @JsonProperty("Sedentary") SEDENTARY,
        @JsonProperty("Light") LIGHT,
        @JsonProperty("Moderate") MODERATE,
        @JsonProperty("Active") ACTIVE,
        @JsonProperty("Very Active") VERY_ACTIVE
    }

    public enum Diet {
        @JsonProperty("Standard") STANDARD,
        @JsonProperty("Mediterranean") MEDITERRANEAN,
        @JsonProperty("Plant-based") PLANT_BASED,
        @JsonProperty("Low-carb") LOW_CARB,
        @JsonProperty("Other") OTHER
    }

    public enum FamilyCancer {
        @JsonProperty("None") NONE,
        @JsonProperty("Breast") BREAST,
        @JsonProperty("Prostate") PROSTATE,
        @JsonProperty("Lung") LUNG,
        @JsonProperty("Colorectal") COLORECTAL,
        @JsonProperty("Other") OTHER
    }
}
