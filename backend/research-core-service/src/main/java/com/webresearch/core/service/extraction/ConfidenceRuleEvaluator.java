package com.webresearch.core.service.extraction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Applies schema confidence rules to extraction data.
 *
 * 규칙 평가 중 발생한 오류는 해당 규칙만 건너뛰고 점수 계산은 계속합니다.
 */
@Component
@Slf4j
public class ConfidenceRuleEvaluator {

    /**
     * @return base confidence plus the adjustment of every matching rule, clamped to [0, 1]
     */
    public double apply(double baseConfidence, Map<String, Object> data, List<ConfidenceRule> rules) {
        double confidence = baseConfidence;
        if (rules == null || data == null) {
            return clamp(confidence);
        }
        for (ConfidenceRule rule : rules) {
            try {
                if (matches(rule, data)) {
                    confidence += rule.adjustment();
                    log.trace("Rule matched: {} ({})", rule.reason(), rule.adjustment());
                }
            } catch (RuntimeException e) {
                log.warn("Skipping confidence rule '{}' on field '{}': {}", rule.reason(), rule.field(), e.getMessage());
            }
        }
        return clamp(confidence);
    }

    boolean matches(ConfidenceRule rule, Map<String, Object> data) {
        Object actual = data.get(rule.field());
        if (rule instanceof ConfidenceRule.HasField) {
            return actual != null && !(actual instanceof String s && s.isBlank());
        }
        if (rule instanceof ConfidenceRule.LengthAbove lengthAbove) {
            if (actual instanceof Collection<?> collection) {
                return collection.size() > lengthAbove.length();
            }
            if (actual instanceof String s) {
                return s.length() > lengthAbove.length();
            }
            return false;
        }
        if (rule instanceof ConfidenceRule.Threshold threshold) {
            return compare(actual, threshold);
        }
        throw new IllegalArgumentException("Unsupported rule type " + rule.getClass().getSimpleName());
    }

    private boolean compare(Object actual, ConfidenceRule.Threshold threshold) {
        if (actual == null) {
            return false;
        }
        if (threshold.comparison() == ConfidenceRule.Comparison.EQ
                && !(actual instanceof Number && threshold.value() instanceof Number)) {
            return String.valueOf(actual).equals(String.valueOf(threshold.value()));
        }
        double left = toDouble(actual);
        double right = toDouble(threshold.value());
        return switch (threshold.comparison()) {
            case EQ -> Double.compare(left, right) == 0;
            case GT -> left > right;
            case GTE -> left >= right;
            case LT -> left < right;
            case LTE -> left <= right;
        };
    }

    private static double toDouble(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            return Double.parseDouble(s.trim());
        }
        throw new IllegalArgumentException("Not a number: " + value);
    }

    private static double clamp(double value) {
        return Math.max(0, Math.min(1, value));
    }
}
