package com.webresearch.core.dto.source;

/**
 * A normalized value reported by a domain for the same question
 */
public record DomainObservation(String domain, String value) {
}
