package com.webresearch.core.dto.plan;

import com.webresearch.core.entity.NavigationType;

import java.util.List;

public record DomainExpectation(
        String domain,
        List<String> expectedPages,
        List<String> extractionTargets,
        NavigationType navigationType
) {
}
