package com.webresearch.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * URL and domain canonicalization shared by cache keys, claim sources and domain scores.
 */
public final class UrlNormalizer {

    private UrlNormalizer() {
    }

    /**
     * scheme + host (+ port) + path, trailing slash stripped, lower-cased, {@code www.} removed.
     * Input that does not parse as an absolute URL is only lower-cased.
     */
    public static String normalize(String url) {
        if (url == null) {
            return "";
        }
        try {
            URI uri = new URI(url.trim());
            if (uri.getScheme() == null || uri.getHost() == null) {
                return url.toLowerCase(Locale.ROOT);
            }
            StringBuilder normalized = new StringBuilder()
                    .append(uri.getScheme())
                    .append("://")
                    .append(uri.getHost());
            if (uri.getPort() != -1) {
                normalized.append(':').append(uri.getPort());
            }
            if (uri.getRawPath() != null) {
                normalized.append(uri.getRawPath());
            }
            String result = normalized.toString();
            if (result.endsWith("/")) {
                result = result.substring(0, result.length() - 1);
            }
            return result.toLowerCase(Locale.ROOT).replace("://www.", "://");
        } catch (URISyntaxException e) {
            return url.toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Host of the URL without {@code www.}; the input itself when it is not a URL.
     */
    public static String extractDomain(String url) {
        if (url == null) {
            return "";
        }
        try {
            URI uri = new URI(url.trim());
            if (uri.getHost() == null) {
                return url;
            }
            return stripWww(uri.getHost().toLowerCase(Locale.ROOT));
        } catch (URISyntaxException e) {
            return url;
        }
    }

    public static String normalizeDomain(String domain) {
        return stripWww(domain.trim().toLowerCase(Locale.ROOT));
    }

    private static String stripWww(String host) {
        return host.startsWith("www.") ? host.substring(4) : host;
    }
}
