package com.precare.risk.engine;

import com.precare.risk.model.PatientRecord;

import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;

/**
 * Sums threshold-gated linear terms on top of a base risk.
 * <p>
 * Risk only accumulates: every term contributes a non-negative magnitude, and a term that
 * would subtract fails the run instead.
 */
public final class ContributionEvaluator {

    /**
     * A gated contribution: {@code magnitude} is added when {@code when} holds.
     */
    public record Term(
            Predicate<PatientRecord> when,
            ToDoubleFunction<PatientRecord> magnitude
    ) {
        public boolean fires(PatientRecord record) {
            return when.test(record);
        }
    }

    public static double evaluate(double baseRisk, PatientRecord record, List<Term> terms) {
        double risk = baseRisk;
        for (Term term : terms) {
            if (!term.fires(record)) continue;
            double contribution = term.magnitude().applyAsDouble(record);
            if (contribution < 0 || Double.isNaN(contribution)) {
                throw new IllegalStateException("Risk term produced a non-accumulating contribution: " + contribution);
            }
            risk += contribution;
        }
        return risk;
    }

    /** Flat {@code weight} when {@code when} holds. */
    public static Term flat(Predicate<PatientRecord> when, double weight) {
        requireNonNegative(weight);
        return new Term(when, r -> weight);
    }

    /** {@code (field - threshold) * rate} when {@code field > threshold}. */
    public static Term excessOver(ToDoubleFunction<PatientRecord> field, double threshold, double rate) {
        requireNonNegative(rate);
        return new Term(r -> field.applyAsDouble(r) > threshold,
                r -> (field.applyAsDouble(r) - threshold) * rate);
    }

    /** {@code (field - threshold) * rate} when {@code field >= threshold}. */
    public static Term excessFrom(ToDoubleFunction<PatientRecord> field, double threshold, double rate) {
        requireNonNegative(rate);
        return new Term(r -> field.applyAsDouble(r) >= threshold,
                r -> (field.applyAsDouble(r) - threshold) * rate);
    }

    /** Contribution computed outside the record, e.g. from an upstream condition result. */
    public static Term always(double magnitude) {
        requireNonNegative(magnitude);
        return new Term(r -> true, r -> magnitude);
    }

    /**
     * Exactly one of two terms applies, selected per record.
     */
    public static Term branch(Predicate<PatientRecord> selector, Term whenTrue, Term otherwise) {
        return new Term(
                r -> (selector.test(r) ? whenTrue : otherwise).fires(r),
                r -> (selector.test(r) ? whenTrue : otherwise).magnitude().applyAsDouble(r)
        );
    }

    /**
     * Mutually exclusive tiers: only the first tier that fires contributes.
     */
    public static Term firstOf(Term... tiers) {
        List<Term> ordered = Arrays.asList(tiers);
        return new Term(
                r -> ordered.stream().anyMatch(t -> t.fires(r)),
                r -> ordered.stream()
                        .filter(t -> t.fires(r))
                        .findFirst()
                        .map(t -> t.magnitude().applyAsDouble(r))
                        .orElse(0.0)
        );
    }

    private static void requireNonNegative(double weight) {
        if (weight < 0 || Double.isNaN(weight)) {
            throw new IllegalArgumentException("Risk weights must be non-negative, got " + weight);
        }
    }

    private ContributionEvaluator() {}
}
