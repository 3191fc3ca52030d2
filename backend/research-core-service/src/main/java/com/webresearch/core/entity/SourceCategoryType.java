package com.webresearch.core.entity;

/**
 * Category of source a question should be answered from
 */
public enum SourceCategoryType {
    OFFICIAL("official"),
    DOCS("docs"),
    CODE("code"),
    NEWS("news"),
    REVIEWS("reviews"),
    FORUMS("forum"),
    FILINGS("filings");

    /**
     * Category label used by source tier rules
     */
    private final String ruleCategory;

    SourceCategoryType(String ruleCategory) {
        this.ruleCategory = ruleCategory;
    }

    public String getRuleCategory() {
        return ruleCategory;
    }

    public String label() {
        return name().toLowerCase();
    }
}
