package com.webresearch.core.service.claim;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Canonical comparison form of extraction data and the similarity rules applied to it
 */
final class ClaimValues {

    static final double SIMILARITY_THRESHOLD = 0.8;
    static final double NUMERIC_VARIANCE = 0.05;

    private ClaimValues() {
    }

    /**
     * Keys lose case, underscores, whitespace and dashes. Strings are trimmed and lower-cased,
     * numbers become doubles and lists are normalized element-wise then sorted.
     */
    static Map<String, Object> normalize(Map<String, Object> data) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        if (data == null) {
            return normalized;
        }
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            String key = entry.getKey().toLowerCase(Locale.ROOT).replaceAll("[_\\s-]", "");
            normalized.put(key, normalizeElement(entry.getValue()));
        }
        return normalized;
    }

    private static Object normalizeElement(Object value) {
        if (value instanceof String s) {
            return s.trim().toLowerCase(Locale.ROOT);
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof List<?> list) {
            List<Object> items = new ArrayList<>();
            for (Object item : list) {
                items.add(normalizeElement(item));
            }
            items.sort(Comparator.comparing(String::valueOf));
            return items;
        }
        return value;
    }

    /**
     * Two normalized values describe the same fact.
     */
    static boolean similar(Object value1, Object value2) {
        if (value1 instanceof Map<?, ?> m1 && value2 instanceof Map<?, ?> m2) {
            if (!m1.keySet().equals(m2.keySet())) {
                return Objects.equals(m1, m2);
            }
            for (Object key : m1.keySet()) {
                if (!similar(m1.get(key), m2.get(key))) {
                    return false;
                }
            }
            return true;
        }
        if (value1 instanceof String s1 && value2 instanceof String s2) {
            return wordJaccard(s1, s2) >= SIMILARITY_THRESHOLD;
        }
        if (value1 instanceof Number n1 && value2 instanceof Number n2) {
            double a = n1.doubleValue();
            double b = n2.doubleValue();
            double variance = Math.abs(a - b) / Math.max(Math.max(a, b), 1);
            return variance <= NUMERIC_VARIANCE;
        }
        if (value1 instanceof List<?> l1 && value2 instanceof List<?> l2) {
            Set<String> set1 = l1.stream().map(String::valueOf).collect(Collectors.toSet());
            Set<String> set2 = l2.stream().map(String::valueOf).collect(Collectors.toSet());
            return jaccard(set1, set2) >= SIMILARITY_THRESHOLD;
        }
        return Objects.equals(value1, value2);
    }

    static double wordJaccard(String s1, String s2) {
        Set<String> words1 = new HashSet<>(Arrays.asList(s1.toLowerCase(Locale.ROOT).trim().split("\\s+")));
        Set<String> words2 = new HashSet<>(Arrays.asList(s2.toLowerCase(Locale.ROOT).trim().split("\\s+")));
        return jaccard(words1, words2);
    }

    private static double jaccard(Set<String> set1, Set<String> set2) {
        Set<String> union = new HashSet<>(set1);
        union.addAll(set2);
        if (union.isEmpty()) {
            return 1.0;
        }
        Set<String> intersection = new HashSet<>(set1);
        intersection.retainAll(set2);
        return (double) intersection.size() / union.size();
    }

    /**
     * "key: value; key2: a, b" with empty values skipped.
     */
    static String describe(Map<String, Object> data) {
        List<String> parts = new ArrayList<>();
        if (data != null) {
            for (Map.Entry<String, Object> entry : data.entrySet()) {
                Object value = entry.getValue();
                if (value == null || "".equals(value)) {
                    continue;
                }
                if (value instanceof List<?> list) {
                    parts.add(entry.getKey() + ": " + list.stream().map(String::valueOf).collect(Collectors.joining(", ")));
                } else {
                    parts.add(entry.getKey() + ": " + value);
                }
            }
        }
        return parts.isEmpty() ? String.valueOf(data) : String.join("; ", parts);
    }
}
