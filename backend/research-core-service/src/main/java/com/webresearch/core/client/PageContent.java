package com.webresearch.core.client;

public record PageContent(String html, String text) {

    public static PageContent empty() {
        return new PageContent("", "");
    }
}
