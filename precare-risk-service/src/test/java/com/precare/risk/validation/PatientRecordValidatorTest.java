package com.precare.risk.validation;

import com.precare.risk.exception.InvalidRecordFieldException;
import com.precare.risk.model.PatientRecord;
import com.precare.risk.testsupport.PatientRecords;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PatientRecordValidatorTest {

    private final PatientRecordValidator validator = new PatientRecordValidator();

    @Test
    void acceptsRecordsInsideEveryRange() {
        assertThatCode(() -> validator.validate(PatientRecords.sarahJohnson())).doesNotThrowAnyException();
        assertThatCode(() -> validator.validate(PatientRecords.worstCase())).doesNotThrowAnyException();
        assertThatCode(() -> validator.validate(PatientRecords.lowRiskMale())).doesNotThrowAnyException();
    }

    @Test
    void rangeBoundsAreInclusive() {
        PatientRecord atBounds = PatientRecords.sarahJohnson().toBuilder()
                .age(18)
                .heightCm(250)
                .weightKg(30)
                .systolicBp(70)
                .hba1c(3.0)
                .hdlCholesterol(100)
                .build();

        assertThatCode(() -> validator.validate(atBounds)).doesNotThrowAnyException();
    }

    @Test
    void outOfRangeField_isNamedInTheError() {
        PatientRecord record = PatientRecords.sarahJohnson().toBuilder().systolicBp(210).build();

        assertThatThrownBy(() -> validator.validate(record))
                .isInstanceOfSatisfying(InvalidRecordFieldException.class,
                        e -> assertThat(e.getField()).isEqualTo("systolicBp"))
                .hasMessage("Invalid record field 'systolicBp': must be between 70 and 200, was 210");
    }

    @Test
    void zeroHdl_isRejected() {
        PatientRecord record = PatientRecords.sarahJohnson().toBuilder().hdlCholesterol(0).build();

        assertThatThrownBy(() -> validator.validate(record))
                .isInstanceOf(InvalidRecordFieldException.class)
                .hasMessageContaining("hdlCholesterol");
    }

    @Test
    void notANumber_isRejected() {
        PatientRecord record = PatientRecords.sarahJohnson().toBuilder().hba1c(Double.NaN).build();

        assertThatThrownBy(() -> validator.validate(record))
                .isInstanceOf(InvalidRecordFieldException.class)
                .hasMessageContaining("hba1c");
    }

    @Test
    void missingGenderOrRecord_isRejected() {
        PatientRecord noGender = PatientRecords.sarahJohnson().toBuilder().gender(null).build();

        assertThatThrownBy(() -> validator.validate(noGender))
                .isInstanceOf(InvalidRecordFieldException.class)
                .hasMessageContaining("gender");
        assertThatThrownBy(() -> validator.validate(null))
                .isInstanceOf(InvalidRecordFieldException.class);
    }
}
