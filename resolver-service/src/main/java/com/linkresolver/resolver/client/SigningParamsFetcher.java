package com.linkresolver.resolver.client;

import com.linkresolver.common.exception.ExternalApiException;
import com.linkresolver.common.exception.UpstreamHttpException;
import com.linkresolver.common.util.SensitiveDataFilter;
import com.linkresolver.resolver.constants.ResolverConstants;
import com.linkresolver.resolver.proxy.ProxyConfig;
import com.linkresolver.resolver.proxy.ProxyProvider;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.time.Duration;
import java.util.Optional;

/**
 * First RPC phase: loads the article page and reads the signature and timestamp the batch endpoint requires.
 * Each {@link RequestProfile} is tried in turn until one yields both attributes.
 */
@Slf4j
public class SigningParamsFetcher {

	private final HttpTransport transport;
	private final String baseUrl;
	private final Duration pageTimeout;

	public SigningParamsFetcher(HttpTransport transport, String baseUrl, Duration pageTimeout) {
		this.transport = transport;
		this.baseUrl = baseUrl;
		this.pageTimeout = pageTimeout;
	}

	public Optional<SigningParams> fetch(String articleId, ProxyProvider proxyProvider) {
		for (RequestProfile profile : RequestProfile.values()) {
			Optional<SigningParams> params = fetchWith(profile, articleId, proxyProvider);
			if (params.isPresent()) {
				log.debug("Got signing params with {} profile", profile);
				return params;
			}
		}
		log.debug("No profile yielded signing params for {}", articleId);
		return Optional.empty();
	}

	Optional<SigningParams> fetchWith(RequestProfile profile, String articleId, ProxyProvider proxyProvider) {
		String pageUrl = profile.articlePageUrl(baseUrl, articleId);
		ProxyConfig proxy = proxyProvider.getProxyConfig(pageUrl);
		if (proxy.isEmpty()) {
			log.debug("No proxy available for article page request, connecting directly");
		} else {
			log.debug("Using proxy {} for article page", SensitiveDataFilter.maskProxyUrl(proxy.proxyUrl()));
		}

		try {
			String body = transport.get(pageUrl, profile.headers(baseUrl), proxy, pageTimeout);
			return parse(body, articleId, profile);
		} catch (UpstreamHttpException e) {
			log.debug("Article page fetch with {} profile failed: HTTP {}", profile, e.getStatusCode());
			if (e.isBlocked()) {
				log.warn("Proxy error {} on article page - rotating proxy", e.getStatusCode());
				proxyProvider.reportProxyError(pageUrl, e, e.getStatusCode());
				proxyProvider.rotateProxy();
			}
		} catch (ExternalApiException e) {
			log.debug("Article page fetch with {} profile failed: {}", profile, e.getMessage());
		}
		return Optional.empty();
	}

	static Optional<SigningParams> parse(String html, String articleId, RequestProfile profile) {
		if (StringUtils.isBlank(html)) {
			return Optional.empty();
		}
		Document document = Jsoup.parse(html);
		Element container = document.selectFirst(ResolverConstants.SIGNED_CONTAINER_SELECTOR);
		if (container == null) {
			log.debug("Signed container not found with {} profile", profile);
			return Optional.empty();
		}

		String signature = container.attr(ResolverConstants.SIGNATURE_ATTRIBUTE);
		String timestamp = container.attr(ResolverConstants.TIMESTAMP_ATTRIBUTE);
		if (StringUtils.isAnyBlank(signature, timestamp)) {
			log.debug("Signature or timestamp missing with {} profile", profile);
			return Optional.empty();
		}
		try {
			return Optional.of(new SigningParams(articleId, signature, Long.parseLong(timestamp.trim()), profile));
		} catch (NumberFormatException e) {
			log.debug("Non-numeric timestamp '{}' with {} profile", timestamp, profile);
			return Optional.empty();
		}
	}
}
