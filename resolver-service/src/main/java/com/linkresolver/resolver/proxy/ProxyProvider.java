package com.linkresolver.resolver.proxy;

/**
 * Source of outbound proxies for resolution requests.
 */
public interface ProxyProvider {

    /**
     * @param targetUrl URL about to be requested
     * @return proxy to use, or {@link ProxyConfig#none()} to connect directly
     */
    ProxyConfig getProxyConfig(String targetUrl);

    /**
     * Forces the next {@link #getProxyConfig(String)} call onto a different proxy.
     */
    void rotateProxy();

    void reportProxyError(String targetUrl, Throwable error, int statusCode);

    /**
     * Whether rotating can change anything. A provider with nothing to rotate makes a
     * "retry with a fresh proxy" pointless.
     */
    default boolean canRotate() {
        return true;
    }
}
