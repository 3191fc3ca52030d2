package com.webresearch.core.dto.plan;

import com.webresearch.core.entity.AnswerKind;

public record AnswerType(
        String questionId,
        AnswerKind expectedType,
        String format,
        String unit
) {
}
