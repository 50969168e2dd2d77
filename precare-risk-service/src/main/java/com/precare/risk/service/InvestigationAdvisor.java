package com.precare.risk.service;

import com.precare.risk.dto.AssessmentDtos.RecommendedInvestigations;
import com.precare.risk.model.PatientRecord;
import com.precare.risk.model.PatientRecord.FamilyCancer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Suggests immediate and follow-up tests from the raw record.
 */
@Component
public class InvestigationAdvisor {

    private static final List<String> STANDING_FOLLOW_UP = List.of(
            "Annual HbA1c monitoring",
            "Cardiovascular risk assessment",
            "Cancer screening as per guidelines"
    );

    public RecommendedInvestigations recommend(PatientRecord record) {
        List<String> immediate = new ArrayList<>();
        List<String> followUp = new ArrayList<>();

        if (record.hba1c() >= 5.7) {
            immediate.addAll(List.of("Oral Glucose Tolerance Test", "Fasting Insulin"));
        }
        if (record.systolicBp() >= 130) {
            immediate.addAll(List.of("24-hour BP monitoring", "ECG"));
        }
        if (record.age() >= 45) {
            immediate.addAll(List.of("Lipid Profile", "Kidney Function Tests"));
        }

        if (record.familyCancer() == FamilyCancer.BREAST) {
            followUp.addAll(List.of("BRCA Gene Testing", "Enhanced MRI Screening"));
        }
        followUp.addAll(STANDING_FOLLOW_UP);

        return new RecommendedInvestigations(List.copyOf(immediate), List.copyOf(followUp));
    }
}
