package com.precare.risk.service;

import com.precare.risk.dto.AssessmentDtos.ConditionSummary;
import com.precare.risk.model.Condition;
import com.precare.risk.repository.ConditionCatalogRepository;
import com.precare.risk.repository.ConditionCatalogRepository.CatalogEntry;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ConditionService {

    private final ConditionCatalogRepository repo;

    public ConditionService(ConditionCatalogRepository repo) {
        this.repo = repo;
    }

    public List<ConditionSummary> list() {
        return repo.findAll().stream()
                .map(ConditionService::toSummary)
                .toList();
    }

    public ConditionSummary get(String conditionId) {
        return repo.findById(conditionId)
                .map(ConditionService::toSummary)
                .orElseThrow(() -> new IllegalArgumentException("Unknown condition: " + conditionId));
    }

    private static ConditionSummary toSummary(CatalogEntry entry) {
        return new ConditionSummary(
                entry.identifier(),
                entry.name(),
                Condition.fromId(entry.identifier()).riskCap(),
                entry.recommendations()
        );
    }
}
