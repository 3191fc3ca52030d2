package com.webresearch.core.entity;

/**
 * Terminal reason of a research session
 */
public enum StopReason {
    CONFIDENCE_REACHED,
    MARGINAL_GAIN_LOW,
    BUDGET_EXHAUSTED,
    USER_STOP,
    ERROR
}
