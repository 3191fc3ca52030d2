package com.webresearch.core.dto.cache;

/**
 * @param hitRate  total hits divided by entry count
 * @param avgAgeMs mean age of live entries
 */
public record CacheStats(int size, double hitRate, double avgAgeMs) {
}
