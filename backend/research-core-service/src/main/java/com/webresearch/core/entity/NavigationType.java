package com.webresearch.core.entity;

public enum NavigationType {
    DIRECT,
    SEARCH,
    CRAWL
}
