package com.plantwatch.service.notification;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;

/**
 * Typed configuration of one notification channel kind.
 */
public interface ChannelConfig {

    /**
     * Names the fields that are missing or malformed; empty when the config
     * can be used as is.
     */
    List<String> problems();

    /**
     * Absolute http(s) URL with a host, usable as is by the HTTP client.
     * Template placeholders such as {@code {id}} are rejected.
     */
    static boolean isHttpUrl(String value) {
        if (value == null || value.indexOf('{') >= 0 || value.indexOf('}') >= 0) {
            return false;
        }
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            return uri.isAbsolute()
                    && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
                    && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
