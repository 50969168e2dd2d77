package com.precare.risk.service;

import com.precare.risk.dto.AssessmentDtos.AssessmentResponse;
import com.precare.risk.dto.AssessmentDtos.PersonalizedRecommendation;
import com.precare.risk.engine.RiskAggregator;
import com.precare.risk.exception.InvalidRecordFieldException;
import com.precare.risk.insight.ClaudeInsightClient;
import com.precare.risk.model.Condition;
import com.precare.risk.model.PatientRecord;
import com.precare.risk.model.RiskResultSet;
import com.precare.risk.testsupport.KnowledgeBaseFixture;
import com.precare.risk.testsupport.PatientRecords;
import com.precare.risk.validation.PatientRecordValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RiskAssessmentServiceTest {

    private KnowledgeBaseFixture fixture;
    private RiskAggregator aggregator;
    private ClaudeInsightClient insights;

    @BeforeEach
    void setUp() {
        fixture = new KnowledgeBaseFixture();
        aggregator = fixture.aggregator();
        insights = mock(ClaudeInsightClient.class);
    }

    private RiskAssessmentService service(Executor executor, long waitMs) {
        return new RiskAssessmentService(aggregator, new InvestigationAdvisor(), fixture.catalog,
                new PatientRecordValidator(), insights, executor, waitMs);
    }

    @Test
    void assess_attachesNarrativeComputedFromTheFinishedResults() {
        PatientRecord record = PatientRecords.sarahJohnson();
        when(insights.riskInsights(eq(record), any())).thenReturn(Optional.of("Focus on glucose control."));

        AssessmentResponse response = service(Runnable::run, 1000).assess(record);

        assertThat(response.patientId()).isEqualTo("78901");
        assertThat(response.bmi()).isCloseTo(25.71, within(0.01));
        assertThat(response.insights().available()).isTrue();
        assertThat(response.insights().text()).isEqualTo("Focus on glucose control.");
        assertThat(response.investigations().immediate()).contains("Oral Glucose Tolerance Test");
        verify(insights).riskInsights(record, response.results());
    }

    @Test
    void insightFailure_keepsScoresAndReturnsPlaceholder() {
        PatientRecord record = PatientRecords.sarahJohnson();
        when(insights.riskInsights(any(), any())).thenThrow(new IllegalStateException("boom"));

        AssessmentResponse response = service(Runnable::run, 1000).assess(record);

        assertThat(response.insights().available()).isFalse();
        assertThat(response.insights().text()).isEqualTo(RiskAssessmentService.INSIGHTS_UNAVAILABLE);
        assertThat(response.results()).isEqualTo(aggregator.calculateAllRisks(record));
    }

    @Test
    void emptyInsight_returnsPlaceholder() {
        when(insights.riskInsights(any(), any())).thenReturn(Optional.empty());

        AssessmentResponse response = service(Runnable::run, 1000).assess(PatientRecords.sarahJohnson());

        assertThat(response.insights().available()).isFalse();
        assertThat(response.results().get(Condition.KIDNEY_DISEASE).riskPercentage())
                .isCloseTo(15.731, within(0.001));
    }

    @Test
    void slowInsight_isAbandonedAfterTheWait() {
        Executor neverRuns = task -> { };

        AssessmentResponse response = service(neverRuns, 50).assess(PatientRecords.sarahJohnson());

        assertThat(response.insights().available()).isFalse();
        assertThat(response.insights().text()).isEqualTo(RiskAssessmentService.INSIGHTS_UNAVAILABLE);
        verifyNoInteractions(insights);
    }

    @Test
    void invalidRecord_neverReachesTheInsightGenerator() {
        PatientRecord record = PatientRecords.sarahJohnson().toBuilder().hba1c(20).build();

        assertThatThrownBy(() -> service(Runnable::run, 1000).assess(record))
                .isInstanceOf(InvalidRecordFieldException.class);
        verifyNoInteractions(insights);
    }

    @Test
    void calculateAllRisks_delegatesToTheAggregator() {
        RiskResultSet results = service(Runnable::run, 1000).calculateAllRisks(PatientRecords.sarahJohnson());

        assertThat(results.get(Condition.STROKE).riskPercentage()).isCloseTo(23.0, within(1e-9));
        verifyNoInteractions(insights);
    }

    @Test
    void personalizedRecommendations_combineStaticListAndNarrative() {
        PatientRecord record = PatientRecords.sarahJohnson();
        when(insights.personalizedRecommendations(record, "Stroke")).thenReturn(Optional.of("Walk daily."));

        PersonalizedRecommendation result = service(Runnable::run, 1000)
                .personalizedRecommendations("stroke", record);

        assertThat(result.condition()).isEqualTo("stroke");
        assertThat(result.recommendations()).hasSize(5).startsWith("Blood pressure management");
        assertThat(result.narrative().available()).isTrue();
        assertThat(result.narrative().text()).isEqualTo("Walk daily.");
    }

    @Test
    void personalizedRecommendations_fallBackToPlaceholder() {
        when(insights.personalizedRecommendations(any(), any())).thenReturn(Optional.empty());

        PersonalizedRecommendation result = service(Runnable::run, 1000)
                .personalizedRecommendations("diabetes", PatientRecords.sarahJohnson());

        assertThat(result.narrative().available()).isFalse();
        assertThat(result.narrative().text()).isEqualTo(RiskAssessmentService.RECOMMENDATIONS_UNAVAILABLE);
        assertThat(result.recommendations()).isNotEmpty();
    }

    @Test
    void personalizedRecommendations_unknownCondition() {
        assertThatThrownBy(() -> service(Runnable::run, 1000)
                .personalizedRecommendations("asthma", PatientRecords.sarahJohnson()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown condition: asthma");
        verifyNoInteractions(insights);
    }
}
