package com.precare.risk.controller;

import com.precare.risk.dto.AssessmentDtos.ConditionSummary;
import com.precare.risk.dto.AssessmentDtos.PersonalizedRecommendation;
import com.precare.risk.model.PatientRecord;
import com.precare.risk.service.ConditionService;
import com.precare.risk.service.RiskAssessmentService;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class ConditionsController {

    private final ConditionService conditions;
    private final RiskAssessmentService assessments;

    public ConditionsController(ConditionService conditions, RiskAssessmentService assessments) {
        this.conditions = conditions;
        this.assessments = assessments;
    }

    @GetMapping("/conditions")
    public List<ConditionSummary> list() {
        return conditions.list();
    }

    @GetMapping("/conditions/{id}")
    public ConditionSummary get(@PathVariable String id) {
        return conditions.get(id);
    }

    @PostMapping("/conditions/{id}/recommendations")
    public PersonalizedRecommendation recommendations(@PathVariable String id,
                                                      @RequestBody PatientRecord record) {
        return assessments.personalizedRecommendations(id, record);
    }
}
