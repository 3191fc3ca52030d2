package com.webresearch.core.client;

import com.webresearch.core.dto.plan.ExecutionPath;

/**
 * Browser automation collaborator. Implementations own all blocking page I/O.
 */
public interface BrowserDriver {

    /**
     * Open an isolated page for one execution path. The caller closes it when the path ends.
     */
    BrowserPage openPage(ExecutionPath path);
}
