package com.webresearch.core.entity;

/**
 * Operating mode that selects the budget preset of a plan
 */
public enum OperatorMode {
    /**
     * Fast, cache-heavy, shallow
     */
    LIGHTNING,

    /**
     * Balanced, verified
     */
    STANDARD,

    /**
     * Multi-path, contradiction aware
     */
    DEEP_RESEARCH,

    /**
     * Authoritative sources only
     */
    COMPLIANCE,

    /**
     * Plan only, no execution
     */
    SIMULATION
}
