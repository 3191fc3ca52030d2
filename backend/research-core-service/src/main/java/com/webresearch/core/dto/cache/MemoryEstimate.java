package com.webresearch.core.dto.cache;

public record MemoryEstimate(long bytes, String formatted) {
}
