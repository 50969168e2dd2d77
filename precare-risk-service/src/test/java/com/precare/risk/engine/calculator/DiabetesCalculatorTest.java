package com.precare.risk.engine.calculator;

import com.precare.risk.model.PatientRecord;
import com.precare.risk.model.RiskLevel;
import com.precare.risk.model.RiskResult;
import com.precare.risk.testsupport.KnowledgeBaseFixture;
import com.precare.risk.testsupport.PatientRecords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DiabetesCalculatorTest {

    private DiabetesCalculator calculator;

    @BeforeEach
    void setUp() {
        KnowledgeBaseFixture fixture = new KnowledgeBaseFixture();
        calculator = new DiabetesCalculator(fixture.models, fixture.catalog);
    }

    @Test
    void sampleRecord_hba1cAtThresholdAddsNothing() {
        RiskResult result = calculator.calculate(PatientRecords.sarahJohnson(), Map.of());

        // 0.08 + 5 * 0.015 + (25.7117 - 23) * 0.04 + (5.7 - 5.7) * 0.35
        assertThat(result.riskPercentage()).isCloseTo(26.347, within(0.001));
        assertThat(result.riskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(result.keyFactors()).containsExactly("Prediabetic HbA1c", "BMI");
        assertThat(result.recommendations()).hasSize(5).startsWith("Structured meal planning");
    }

    @Test
    void historyFlagsAndHighHba1c_reachTheCap() {
        PatientRecord record = PatientRecords.sarahJohnson().toBuilder()
                .gestationalDiabetes(true)
                .familyDiabetes(true)
                .hba1c(6.5)
                .build();

        RiskResult result = calculator.calculate(record, Map.of());

        assertThat(result.riskPercentage()).isEqualTo(95.0);
        assertThat(result.riskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(result.keyFactors()).containsExactly(
                "Prediabetic HbA1c", "Gestational diabetes history", "Family history", "BMI");
    }

    @Test
    void gestationalHistory_addsThirtyPoints() {
        PatientRecord without = PatientRecords.lowRiskMale();
        PatientRecord with = without.toBuilder().gestationalDiabetes(true).build();

        double delta = calculator.calculate(with, Map.of()).riskPercentage()
                - calculator.calculate(without, Map.of()).riskPercentage();

        assertThat(delta).isCloseTo(30.0, within(1e-9));
    }

    @Test
    void bmiBetween23And25_isScoredButNotListedAsFactor() {
        PatientRecord record = PatientRecords.sarahJohnson().toBuilder().weightKg(65).build();

        RiskResult result = calculator.calculate(record, Map.of());

        // 0.08 + 0.075 + (23.8751 - 23) * 0.04
        assertThat(result.riskPercentage()).isCloseTo(19.0, within(0.001));
        assertThat(result.keyFactors()).containsExactly("Prediabetic HbA1c");
    }
}
