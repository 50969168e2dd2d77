package com.precare.risk.dto;

import com.precare.risk.model.RiskResultSet;

import java.util.List;

public final class AssessmentDtos {

    public record AssessmentResponse(
            String patientId,
            String name,
            double bmi,
            RiskResultSet results,
            RecommendedInvestigations investigations,
            InsightNarrative insights
    ) {}

    public record RecommendedInvestigations(
            List<String> immediate,
            List<String> followUp
    ) {}

    /**
     * Free-text narrative from the insight generator; {@code available} is false when the
     * call was skipped or failed and {@code text} holds the placeholder.
     */
    public record InsightNarrative(
            boolean available,
            String text
    ) {}

    public record ConditionSummary(
            String id,
            String name,
            double riskCap,
            List<String> recommendations
    ) {}

    public record PersonalizedRecommendation(
            String condition,
            List<String> recommendations,
            InsightNarrative narrative
    ) {}

    private AssessmentDtos() {}
}
