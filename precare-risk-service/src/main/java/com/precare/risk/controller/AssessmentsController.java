package com.precare.risk.controller;

import com.precare.risk.dto.AssessmentDtos.AssessmentResponse;
import com.precare.risk.model.PatientRecord;
import com.precare.risk.model.RiskResultSet;
import com.precare.risk.service.RiskAssessmentService;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1")
public class AssessmentsController {

    private final RiskAssessmentService service;

    public AssessmentsController(RiskAssessmentService service) {
        this.service = service;
    }

    @PostMapping("/risks")
    public RiskResultSet calculateAllRisks(@RequestBody PatientRecord record) {
        return service.calculateAllRisks(record);
    }

    @PostMapping("/assessments")
    public AssessmentResponse assess(@RequestBody PatientRecord record) {
        return service.assess(record);
    }
}
