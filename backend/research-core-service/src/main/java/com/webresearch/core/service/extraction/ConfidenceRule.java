package com.webresearch.core.service.extraction;

/**
 * Typed predicate over extraction data that adjusts the extraction's confidence when it holds.
 *
 * @see ConfidenceRuleEvaluator
 */
public interface ConfidenceRule {

    String field();

    double adjustment();

    String reason();

    /**
     * Field is present and not null or blank.
     */
    record HasField(String field, double adjustment, String reason) implements ConfidenceRule {
    }

    /**
     * Field compared against a fixed value. Ordering comparisons are numeric; EQ also matches strings.
     */
    record Threshold(String field, Comparison comparison, Object value, double adjustment, String reason)
            implements ConfidenceRule {
    }

    /**
     * List size or string length strictly above {@code length}.
     */
    record LengthAbove(String field, int length, double adjustment, String reason) implements ConfidenceRule {
    }

    enum Comparison {
        EQ, GT, GTE, LT, LTE
    }

    static HasField has(String field, double adjustment, String reason) {
        return new HasField(field, adjustment, reason);
    }

    static Threshold equalTo(String field, Object value, double adjustment, String reason) {
        return new Threshold(field, Comparison.EQ, value, adjustment, reason);
    }

    static LengthAbove lengthAbove(String field, int length, double adjustment, String reason) {
        return new LengthAbove(field, length, adjustment, reason);
    }
}
