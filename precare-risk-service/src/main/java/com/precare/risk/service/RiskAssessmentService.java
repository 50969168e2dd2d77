package com.precare.risk.service;

import com.precare.risk.dto.AssessmentDtos.AssessmentResponse;
import com.precare.risk.dto.AssessmentDtos.InsightNarrative;
import com.precare.risk.dto.AssessmentDtos.PersonalizedRecommendation;
import com.precare.risk.dto.AssessmentDtos.RecommendedInvestigations;
import com.precare.risk.engine.RiskAggregator;
import com.precare.risk.insight.ClaudeInsightClient;
import com.precare.risk.model.PatientRecord;
import com.precare.risk.model.RiskResultSet;
import com.precare.risk.repository.ConditionCatalogRepository;
import com.precare.risk.repository.ConditionCatalogRepository.CatalogEntry;
import com.precare.risk.validation.PatientRecordValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import static com.precare.risk.config.AsyncConfig.INSIGHTS_EXECUTOR;

/**
 * Scores a record, then asks the insight generator for a narrative. The narrative is
 * requested only once the result set is complete, and any failure there degrades to a
 * placeholder without touching the scores.
 */
@Service
public class RiskAssessmentService {

    private static final Logger log = LoggerFactory.getLogger(RiskAssessmentService.class);

    public static final String INSIGHTS_UNAVAILABLE = "AI analysis temporarily unavailable.";
    public static final String RECOMMENDATIONS_UNAVAILABLE = "Recommendations temporarily unavailable.";

    private final RiskAggregator aggregator;
    private final InvestigationAdvisor investigations;
    private final ConditionCatalogRepository catalog;
    private final PatientRecordValidator validator;
    private final ClaudeInsightClient insights;
    private final Executor insightsExecutor;
    private final long insightsWaitMs;

    public RiskAssessmentService(RiskAggregator aggregator,
                                 InvestigationAdvisor investigations,
                                 ConditionCatalogRepository catalog,
                                 PatientRecordValidator validator,
                                 ClaudeInsightClient insights,
                                 @Qualifier(INSIGHTS_EXECUTOR) Executor insightsExecutor,
                                 @Value("${precare.external.insights.wait-ms:25000}") long insightsWaitMs) {
        this.aggregator = aggregator;
        this.investigations = investigations;
        this.catalog = catalog;
        this.validator = validator;
        this.insights = insights;
        this.insightsExecutor = insightsExecutor;
        this.insightsWaitMs = insightsWaitMs;
    }

    public RiskResultSet calculateAllRisks(PatientRecord record) {
        return aggregator.calculateAllRisks(record);
    }

    public AssessmentResponse assess(PatientRecord record) {
        RiskResultSet results = aggregator.calculateAllRisks(record);
        RecommendedInvestigations recommended = investigations.recommend(record);

        InsightNarrative narrative = narrate(
                () -> insights.riskInsights(record, results),
                INSIGHTS_UNAVAILABLE,
                "risk insights for patient " + record.id());

        return new AssessmentResponse(record.id(), record.name(), record.bmi(), results, recommended, narrative);
    }

    public PersonalizedRecommendation personalizedRecommendations(String conditionId, PatientRecord record) {
        CatalogEntry entry = catalog.findById(conditionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown condition: " + conditionId));
        validator.validate(record);

        InsightNarrative narrative = narrate(
                () -> insights.personalizedRecommendations(record, entry.name()),
                RECOMMENDATIONS_UNAVAILABLE,
                conditionId + " recommendations for patient " + record.id());

        return new PersonalizedRecommendation(entry.identifier(), entry.recommendations(), narrative);
    }

    private InsightNarrative narrate(Supplier<Optional<String>> call, String placeholder, String purpose) {
        try {
            Optional<String> text = CompletableFuture.supplyAsync(call, insightsExecutor)
                    .get(insightsWaitMs, TimeUnit.MILLISECONDS);
            if (text.isPresent()) {
                return new InsightNarrative(true, text.get());
            }
        } catch (TimeoutException e) {
            log.warn("Gave up waiting for {} after {} ms", purpose, insightsWaitMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for {}", purpose);
        } catch (ExecutionException e) {
            log.warn("Insight generation failed for {}: {}", purpose, e.getCause().getMessage());
        } catch (RuntimeException e) {
            log.warn("Could not schedule {}: {}", purpose, e.getMessage());
        }
        return new InsightNarrative(false, placeholder);
    }
}
