package com.linkresolver.resolver.client;

import com.linkresolver.common.exception.ExternalApiException;
import com.linkresolver.common.exception.UpstreamHttpException;
import com.linkresolver.resolver.proxy.ProxyConfig;
import org.springframework.http.HttpHeaders;

import java.time.Duration;

/**
 * Blocking HTTP calls made by the RPC resolver.
 *
 * <p>Both methods return the body of a 2xx response. A non-2xx answer raises
 * {@link UpstreamHttpException}; connection problems and timeouts raise {@link ExternalApiException}.
 */
public interface HttpTransport {

    String get(String url, HttpHeaders headers, ProxyConfig proxy, Duration timeout);

    String post(String url, HttpHeaders headers, String body, ProxyConfig proxy, Duration timeout);
}
