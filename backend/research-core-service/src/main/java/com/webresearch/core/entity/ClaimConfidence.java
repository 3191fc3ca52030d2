package com.webresearch.core.entity;

/**
 * Confidence level derived from a claim's score and verification counts
 */
public enum ClaimConfidence {
    /**
     * Corroborated or authoritative, uncontested and scoring at least 0.7
     */
    VERIFIED,

    HIGH,

    MEDIUM,

    LOW,

    UNCERTAIN,

    /**
     * Contested by another claim and scoring below 0.3
     */
    CONTRADICTED
}
