package com.webresearch.core.client;

import com.webresearch.core.dto.claim.ExtractionResult;

import java.util.List;

/**
 * A page handle driven by one execution path
 */
public interface BrowserPage extends AutoCloseable {

    NavigationResult navigate(String url);

    /**
     * Markup and visible text of the currently loaded page
     */
    PageContent content();

    /**
     * Run the extraction adapters matching the current page
     *
     * @param schemaNames schemas of the plan, used to pick adapters
     */
    List<ExtractionResult> extract(List<String> schemaNames);

    @Override
    void close();
}
