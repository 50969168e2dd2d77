package com.precare.risk.insight;

import com.precare.risk.model.Condition;
import com.precare.risk.model.PatientRecord;
import com.precare.risk.model.RiskResultSet;

import java.util.Locale;

final class InsightPromptBuilder {

    private static final String RISK_INSIGHTS_TEMPLATE = """
                As a preventive care specialist, analyze this patient's risk profile and provide clinical insights:

                Patient Profile:
                - Age: %d, Gender: %s
                - BMI: %.1f
                - BP: %d/%d mmHg
                - HbA1c: %s%%
                - Total Cholesterol: %s mg/dL
                - LDL: %s mg/dL
                - Family History: Diabetes=%s, Hypertension=%s
                - Personal History: Gestational Diabetes=%s

                Risk Assessment Results:
                - Hypertension: %.1f%%
                - Diabetes: %.1f%%
                - Kidney Disease: %.1f%%
                - Stroke: %.1f%%
                - Heart Disease: %.1f%%

                Please provide:
                1. Key clinical insights about interconnected risks
                2. Priority interventions based on risk profile
                3. Specific recommendations for this patient
                4. Timeline for reassessment

                Focus on evidence-based recommendations and explain the rationale.
                """;

    static String riskInsightsPrompt(PatientRecord record, RiskResultSet results) {
        return String.format(Locale.ROOT, RISK_INSIGHTS_TEMPLATE,
                record.age(), genderLabel(record),
                record.bmi(),
                record.systolicBp(), record.diastolicBp(),
                number(record.hba1c()),
                number(record.totalCholesterol()),
                number(record.ldlCholesterol()),
                record.familyDiabetes(), record.familyHypertension(),
                record.gestationalDiabetes(),
                results.get(Condition.HYPERTENSION).riskPercentage(),
                results.get(Condition.DIABETES).riskPercentage(),
                results.get(Condition.KIDNEY_DISEASE).riskPercentage(),
                results.get(Condition.STROKE).riskPercentage(),
                results.get(Condition.HEART_DISEASE).riskPercentage()
        );
    }

    static String personalizedRecommendationsPrompt(String recordJson, String conditionName) {
        return """
                Provide personalized prevention recommendations for %s based on this patient profile:

                %s

                Include specific, actionable recommendations for:
                1. Lifestyle modifications
                2. Monitoring parameters
                3. When to seek medical attention
                4. Evidence-based preventive measures
                """.formatted(conditionName, recordJson);
    }

    private static String genderLabel(PatientRecord record) {
        if (record.gender() == null) return "Unknown";
        return switch (record.gender()) {
            case FEMALE -> "Female";
            case MALE -> "Male";
            case OTHER -> "Other";
        };
    }

    private static String number(double value) {
        return value == Math.rint(value)
                ? String.valueOf((long) value)
                : String.valueOf(value);
    }

    private InsightPromptBuilder() {}
}
