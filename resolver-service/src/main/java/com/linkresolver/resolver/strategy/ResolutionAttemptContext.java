package com.linkresolver.resolver.strategy;

import com.linkresolver.resolver.browser.BrowserPage;
import com.linkresolver.resolver.decoder.ArticleIdExtractor;
import com.linkresolver.resolver.proxy.ProxyProvider;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * State of a single in-flight resolution. Not shared between calls and not thread-safe.
 */
public class ResolutionAttemptContext {

	private final String requestUrl;
	private final String identifier;
	private final ProxyProvider proxyProvider;
	private final BrowserPage browserPage;
	private final Set<String> triedStrategies = new LinkedHashSet<>();
	private int attemptNumber;

	public ResolutionAttemptContext(String requestUrl, ProxyProvider proxyProvider, BrowserPage browserPage) {
		this.requestUrl = requestUrl;
		this.identifier = ArticleIdExtractor.extract(requestUrl).orElse(null);
		this.proxyProvider = proxyProvider;
		this.browserPage = browserPage;
	}

	public String getRequestUrl() {
		return requestUrl;
	}

	/**
	 * Opaque identifier taken from the {@code /articles/<id>} path, if the link has one.
	 */
	public Optional<String> getIdentifier() {
		return Optional.ofNullable(identifier);
	}

	public ProxyProvider getProxyProvider() {
		return proxyProvider;
	}

	public Optional<BrowserPage> getBrowserPage() {
		return Optional.ofNullable(browserPage);
	}

	public int getAttemptNumber() {
		return attemptNumber;
	}

	public Set<String> getTriedStrategies() {
		return Collections.unmodifiableSet(triedStrategies);
	}

	public void beginAttempt(String strategyName) {
		attemptNumber++;
		triedStrategies.add(strategyName);
	}
}
