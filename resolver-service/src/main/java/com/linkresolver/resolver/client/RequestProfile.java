package com.linkresolver.resolver.client;

import com.linkresolver.resolver.constants.ResolverConstants;
import org.springframework.http.HttpHeaders;

/**
 * Client fingerprints tried, in declaration order, when fetching the article page.
 */
public enum RequestProfile {

	STANDARD(
		"Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36",
		"text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8",
		true, true, false),
	MOBILE(
		"Mozilla/5.0 (iPhone; CPU iPhone OS 14_7_1 like Mac OS X) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/14.1.2 Mobile/15E148 Safari/604.1",
		"text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8",
		true, false, false),
	RSS(
		"Mozilla/5.0 (compatible; Googlebot/2.1; +http://www.google.com/bot.html)",
		"application/rss+xml, application/xml, text/xml",
		true, false, true),
	MINIMAL(
		"curl/7.68.0",
		"*/*",
		false, false, false);

	static final String ACCEPT_LANGUAGE = "en-US,en;q=0.5";

	private final String userAgent;
	private final String accept;
	private final boolean sendAcceptLanguage;
	private final boolean sendReferer;
	private final boolean feedPath;

	RequestProfile(String userAgent, String accept, boolean sendAcceptLanguage, boolean sendReferer, boolean feedPath) {
		this.userAgent = userAgent;
		this.accept = accept;
		this.sendAcceptLanguage = sendAcceptLanguage;
		this.sendReferer = sendReferer;
		this.feedPath = feedPath;
	}

	public String articlePageUrl(String baseUrl, String articleId) {
		return feedPath
			? ResolverConstants.rssArticleUrl(baseUrl, articleId)
			: ResolverConstants.articleUrl(baseUrl, articleId);
	}

	public HttpHeaders headers(String baseUrl) {
		HttpHeaders headers = new HttpHeaders();
		headers.set(HttpHeaders.USER_AGENT, userAgent);
		headers.set(HttpHeaders.ACCEPT, accept);
		if (sendAcceptLanguage) {
			headers.set(HttpHeaders.ACCEPT_LANGUAGE, ACCEPT_LANGUAGE);
		}
		if (sendReferer) {
			headers.set(HttpHeaders.REFERER, baseUrl + "/");
		}
		return headers;
	}

	public String getUserAgent() {
		return userAgent;
	}
}
