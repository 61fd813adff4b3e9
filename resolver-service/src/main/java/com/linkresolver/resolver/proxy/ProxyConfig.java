package com.linkresolver.resolver.proxy;

import java.time.Duration;

/**
 * Outbound connection settings for one request. An empty config means a direct connection.
 */
public record ProxyConfig(String proxyUrl, Duration timeout) {

    private static final ProxyConfig NONE = new ProxyConfig(null, null);

    public static ProxyConfig none() {
        return NONE;
    }

    public boolean isEmpty() {
        return proxyUrl == null || proxyUrl.isBlank();
    }
}
