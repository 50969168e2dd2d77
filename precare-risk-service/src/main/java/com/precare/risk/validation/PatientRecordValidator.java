package com.precare.risk.validation;

import com.precare.risk.exception.InvalidRecordFieldException;
import com.precare.risk.model.PatientRecord;
import org.springframework.stereotype.Component;

/**
 * Precondition check run before scoring. Ranges are the ones the intake form enforces;
 * a record that breaks them is rejected rather than scored.
 */
@Component
public class PatientRecordValidator {

    public void validate(PatientRecord record) {
        if (record == null) {
            throw new InvalidRecordFieldException("record", "must not be null");
        }
        if (record.gender() == null) {
            throw new InvalidRecordFieldException("gender", "is required");
        }
        requireRange("age", record.age(), 18, 100);
        requireRange("heightCm", record.heightCm(), 100, 250);
        requireRange("weightKg", record.weightKg(), 30, 200);
        requireRange("systolicBp", record.systolicBp(), 70, 200);
        requireRange("diastolicBp", record.diastolicBp(), 40, 120);
        requireRange("heartRate", record.heartRate(), 40, 150);
        requireRange("fastingGlucose", record.fastingGlucose(), 50, 300);
        requireRange("hba1c", record.hba1c(), 3.0, 15.0);
        requireRange("totalCholesterol", record.totalCholesterol(), 100, 400);
        requireRange("ldlCholesterol", record.ldlCholesterol(), 50, 300);
        requireRange("hdlCholesterol", record.hdlCholesterol(), 20, 100);
    }

    private static void requireRange(String field, double value, double min, double max) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new InvalidRecordFieldException(field,
                    "must be between " + format(min) + " and " + format(max) + ", was " + format(value));
        }
    }

    private static String format(double value) {
        return value == Math.rint(value) && !Double.isInfinite(value)
                ? String.valueOf((long) value)
                : String.valueOf(value);
    }
}
