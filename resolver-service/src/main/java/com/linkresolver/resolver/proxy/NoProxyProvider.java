package com.linkresolver.resolver.proxy;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class NoProxyProvider implements ProxyProvider {

    @Override
    public ProxyConfig getProxyConfig(String targetUrl) {
        return ProxyConfig.none();
    }

    @Override
    public void rotateProxy() {
        // nothing to rotate
    }

    @Override
    public void reportProxyError(String targetUrl, Throwable error, int statusCode) {
        log.debug("Upstream error {} for {} on a direct connection", statusCode, targetUrl);
    }

    @Override
    public boolean canRotate() {
        return false;
    }
}
