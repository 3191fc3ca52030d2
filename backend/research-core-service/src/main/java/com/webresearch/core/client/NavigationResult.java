package com.webresearch.core.client;

/**
 * @param finalUrl URL after redirects
 * @param error    failure description, null on success
 */
public record NavigationResult(boolean success, String finalUrl, String error) {

    public static NavigationResult ok(String finalUrl) {
        return new NavigationResult(true, finalUrl, null);
    }

    public static NavigationResult failed(String url, String error) {
        return new NavigationResult(false, url, error);
    }
}
