package com.webresearch.core.dto.source;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * URL pattern known to yield a content type on a domain
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UrlPattern {
    private String pattern;
    private String contentType;
    private double reliability;
    private long lastVerified;

    public UrlPattern copy() {
        return new UrlPattern(pattern, contentType, reliability, lastVerified);
    }
}
