package com.webresearch.core.entity;

/**
 * Types of telemetry events recorded during a research session
 */
public enum NavigationEventType {
    PAGE_LOAD,
    EXTRACTION,
    CLAIM_FOUND,
    VERIFICATION,
    STRATEGY_SHIFT,
    PATH_TERMINATED,
    ERROR,
    BLOCKED
}
