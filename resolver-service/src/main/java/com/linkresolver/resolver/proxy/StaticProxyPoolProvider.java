package com.linkresolver.resolver.proxy;

import com.linkresolver.common.util.SensitiveDataFilter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLongArray;

/**
 * Round-robin over a fixed list of proxy URLs. The current proxy is reused until a rotation is requested.
 */
@Slf4j
public class StaticProxyPoolProvider implements ProxyProvider {

    private final List<String> proxyUrls;
    private final Duration timeout;
    private final AtomicInteger current = new AtomicInteger();
    private final AtomicLongArray errorCounts;

    public StaticProxyPoolProvider(List<String> proxyUrls, Duration timeout) {
        if (proxyUrls == null || proxyUrls.isEmpty()) {
            throw new IllegalArgumentException("proxyUrls must not be empty");
        }
        this.proxyUrls = List.copyOf(proxyUrls);
        this.timeout = timeout;
        this.errorCounts = new AtomicLongArray(this.proxyUrls.size());
    }

    @Override
    public ProxyConfig getProxyConfig(String targetUrl) {
        String proxyUrl = proxyUrls.get(currentIndex());
        log.debug("Using proxy {} for {}", SensitiveDataFilter.maskProxyUrl(proxyUrl), targetUrl);
        return new ProxyConfig(proxyUrl, timeout);
    }

    @Override
    public void rotateProxy() {
        int next = current.updateAndGet(i -> (i + 1) % proxyUrls.size());
        log.debug("Rotated to proxy #{}", next);
    }

    @Override
    public void reportProxyError(String targetUrl, Throwable error, int statusCode) {
        int index = currentIndex();
        long errors = errorCounts.incrementAndGet(index);
        log.warn("Proxy {} failed with status {} for {} ({} errors so far): {}",
                SensitiveDataFilter.maskProxyUrl(proxyUrls.get(index)), statusCode, targetUrl, errors,
                error != null ? SensitiveDataFilter.maskSensitiveData(error.getMessage()) : "n/a");
    }

    /**
     * Error counts keyed by masked proxy URL.
     */
    public Map<String, Long> errorCounts() {
        Map<String, Long> result = new LinkedHashMap<>();
        for (int i = 0; i < proxyUrls.size(); i++) {
            result.put(SensitiveDataFilter.maskProxyUrl(proxyUrls.get(i)), errorCounts.get(i));
        }
        return result;
    }

    int currentIndex() {
        return current.get() % proxyUrls.size();
    }
}
