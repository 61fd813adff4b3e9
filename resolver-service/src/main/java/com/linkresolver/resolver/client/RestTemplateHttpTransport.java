package com.linkresolver.resolver.client;

import com.linkresolver.common.exception.ExternalApiException;
import com.linkresolver.common.exception.UpstreamHttpException;
import com.linkresolver.common.util.SensitiveDataFilter;
import com.linkresolver.resolver.proxy.ProxyConfig;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.hc.client5.http.auth.AuthScope;
import org.apache.hc.client5.http.auth.UsernamePasswordCredentials;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.auth.BasicCredentialsProvider;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.util.Timeout;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link HttpTransport} on top of {@link RestTemplate} and Apache HttpClient 5. One client is built per
 * proxy and timeout combination and reused.
 *
 * <p>Proxy credentials from the URL userinfo are answered to the proxy's {@code 407} challenge, which
 * also covers the {@code CONNECT} tunnel used for HTTPS targets.
 */
@Slf4j
public class RestTemplateHttpTransport implements HttpTransport {

	private static final int DEFAULT_PROXY_PORT = 8080;
	private static final Pattern TUNNEL_REFUSED = Pattern.compile("CONNECT refused by proxy: HTTP/\\d(?:\\.\\d)? (\\d{3})");

	private final RestTemplateBuilder builder;
	private final Map<String, HttpComponentsClientHttpRequestFactory> factories = new ConcurrentHashMap<>();
	private final Map<String, RestTemplate> templates = new ConcurrentHashMap<>();

	public RestTemplateHttpTransport(RestTemplateBuilder builder) {
		this.builder = builder;
	}

	@Override
	public String get(String url, HttpHeaders headers, ProxyConfig proxy, Duration timeout) {
		return exchange(HttpMethod.GET, url, headers, null, proxy, timeout);
	}

	@Override
	public String post(String url, HttpHeaders headers, String body, ProxyConfig proxy, Duration timeout) {
		return exchange(HttpMethod.POST, url, headers, body, proxy, timeout);
	}

	private String exchange(HttpMethod method, String url, HttpHeaders headers, String body,
	                        ProxyConfig proxy, Duration timeout) {
		ProxyConfig effective = proxy != null ? proxy : ProxyConfig.none();
		try {
			ResponseEntity<String> response = template(effective, timeout)
				.exchange(url, method, new HttpEntity<>(body, headers), String.class);
			log.debug("{} {} -> {}", method, url, response.getStatusCode().value());
			return response.getBody() != null ? response.getBody() : "";
		} catch (HttpStatusCodeException e) {
			int status = e.getStatusCode().value();
			throw new UpstreamHttpException(status, String.format("HTTP %d from %s", status, url), e);
		} catch (RestClientException e) {
			Optional<Integer> tunnelStatus = tunnelRefusedStatus(e);
			if (tunnelStatus.isPresent()) {
				throw new UpstreamHttpException(tunnelStatus.get(),
					String.format("Proxy refused tunnel to %s: HTTP %d", url, tunnelStatus.get()), e);
			}
			throw new ExternalApiException(String.format("%s %s failed: %s", method, url,
				SensitiveDataFilter.maskSensitiveData(e.getMessage())), e);
		}
	}

	private RestTemplate template(ProxyConfig proxy, Duration timeout) {
		String key = StringUtils.defaultString(proxy.proxyUrl()) + "|" + timeout.toMillis();
		return templates.computeIfAbsent(key, k -> {
			HttpComponentsClientHttpRequestFactory factory = new HttpComponentsClientHttpRequestFactory(
				httpClient(proxy, timeout).build());
			factories.put(k, factory);
			return builder.requestFactory(() -> factory).build();
		});
	}

	static HttpClientBuilder httpClient(ProxyConfig proxy, Duration timeout) {
		ConnectionConfig connectionConfig = ConnectionConfig.custom()
			.setConnectTimeout(Timeout.of(connectTimeout(proxy, timeout)))
			.setSocketTimeout(Timeout.of(timeout))
			.build();
		HttpClientBuilder clientBuilder = HttpClients.custom()
			.setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
				.setDefaultConnectionConfig(connectionConfig)
				.build())
			.disableAutomaticRetries()
			.setDefaultRequestConfig(RequestConfig.custom()
				.setResponseTimeout(Timeout.of(timeout))
				.build());

		if (!proxy.isEmpty()) {
			HttpHost proxyHost = toProxyHost(proxy.proxyUrl());
			clientBuilder.setProxy(proxyHost);
			proxyCredentials(proxy).ifPresent(credentials -> {
				BasicCredentialsProvider provider = new BasicCredentialsProvider();
				provider.setCredentials(new AuthScope(proxyHost.getHostName(), proxyHost.getPort()), credentials);
				clientBuilder.setDefaultCredentialsProvider(provider);
			});
		}
		return clientBuilder;
	}

	/**
	 * The proxy's own timeout bounds connection setup when a proxy is in use; the caller's timeout
	 * bounds the exchange.
	 */
	static Duration connectTimeout(ProxyConfig proxy, Duration timeout) {
		if (proxy.isEmpty() || proxy.timeout() == null) {
			return timeout;
		}
		return proxy.timeout();
	}

	static HttpHost toProxyHost(String proxyUrl) {
		URI uri = URI.create(proxyUrl);
		int port = uri.getPort() > 0 ? uri.getPort() : DEFAULT_PROXY_PORT;
		String scheme = uri.getScheme() != null ? uri.getScheme() : "http";
		return new HttpHost(scheme, uri.getHost(), port);
	}

	static Optional<UsernamePasswordCredentials> proxyCredentials(ProxyConfig proxy) {
		if (proxy.isEmpty()) {
			return Optional.empty();
		}
		String userInfo = URI.create(proxy.proxyUrl()).getRawUserInfo();
		if (StringUtils.isEmpty(userInfo)) {
			return Optional.empty();
		}
		int separator = userInfo.indexOf(':');
		String user = separator >= 0 ? userInfo.substring(0, separator) : userInfo;
		String password = separator >= 0 ? userInfo.substring(separator + 1) : "";
		return Optional.of(new UsernamePasswordCredentials(
			URLDecoder.decode(user, StandardCharsets.UTF_8),
			URLDecoder.decode(password, StandardCharsets.UTF_8).toCharArray()));
	}

	static Optional<Integer> tunnelRefusedStatus(Throwable error) {
		for (Throwable current = error; current != null; current = current.getCause()) {
			if (current.getMessage() != null) {
				Matcher matcher = TUNNEL_REFUSED.matcher(current.getMessage());
				if (matcher.find()) {
					return Optional.of(Integer.parseInt(matcher.group(1)));
				}
			}
		}
		return Optional.empty();
	}

	@PreDestroy
	public void close() {
		factories.values().forEach(factory -> {
			try {
				factory.destroy();
			} catch (Exception e) {
				log.warn("Failed to close HTTP client: {}", e.getMessage());
			}
		});
		factories.clear();
		templates.clear();
	}
}
