package com.webresearch.core.dto.plan;

import java.util.List;

public record PlanValidation(boolean valid, List<String> errors) {
}
