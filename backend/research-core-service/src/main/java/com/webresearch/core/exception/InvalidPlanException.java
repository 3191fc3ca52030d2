package com.webresearch.core.exception;

import java.util.List;

/**
 * A plan that failed validation was handed to the execution driver
 */
public class InvalidPlanException extends ResearchEngineException {

    private final List<String> validationErrors;

    public InvalidPlanException(String sessionId, List<String> validationErrors) {
        super("PLAN_INVALID", "Invalid plan: " + String.join(", ", validationErrors), sessionId);
        this.validationErrors = List.copyOf(validationErrors);
    }

    public List<String> getValidationErrors() {
        return validationErrors;
    }
}
