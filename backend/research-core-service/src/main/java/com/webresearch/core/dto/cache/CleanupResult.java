package com.webresearch.core.dto.cache;

public record CleanupResult(
        int pagesRemoved,
        int extractionsRemoved,
        int domainsRemoved,
        int queriesRemoved
) {

    public int total() {
        return pagesRemoved + extractionsRemoved + domainsRemoved + queriesRemoved;
    }
}
