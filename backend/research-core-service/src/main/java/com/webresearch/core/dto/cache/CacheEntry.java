package com.webresearch.core.dto.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cache slot owned by exactly one cache instance
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry<T> {
    private String key;
    private T value;
    private long createdAt;
    private long expiresAt;
    private int version;
    private int hits;

    public boolean isExpired(long now) {
        return now > expiresAt;
    }
}
