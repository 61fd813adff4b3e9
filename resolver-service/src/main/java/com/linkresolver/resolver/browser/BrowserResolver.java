package com.linkresolver.resolver.browser;

import com.linkresolver.common.validation.ResolvedUrlValidator;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Last resort: lets a real browser follow the redirect, then scrapes the page for an outbound link
 * if it stayed on the aggregator.
 */
@Slf4j
public class BrowserResolver {

	static final String ARTICLE_LINK_SELECTOR = "article a[href*=\"http\"]:not([href*=\"google.com\"])";

	static final List<String> ALTERNATIVE_SELECTORS = List.of(
		"a[data-n-tid]",
		"a[jsname]",
		"a[href]:not([href*=\"google.com\"])",
		"[role=\"link\"]"
	);

	private final ResolvedUrlValidator validator;
	private final String aggregatorHost;
	private final Duration navigationTimeout;
	private final Duration settleDelay;

	public BrowserResolver(ResolvedUrlValidator validator, String aggregatorHost,
	                       Duration navigationTimeout, Duration settleDelay) {
		this.validator = validator;
		this.aggregatorHost = aggregatorHost;
		this.navigationTimeout = navigationTimeout;
		this.settleDelay = settleDelay;
	}

	public Optional<String> resolve(String link, BrowserPage page) {
		if (!page.goTo(link, navigationTimeout)) {
			log.debug("No response from {}", link);
			return Optional.empty();
		}
		page.waitFor(settleDelay);

		String finalUrl = page.url();
		if (finalUrl != null && !finalUrl.equals(link) && !finalUrl.contains(aggregatorHost)
			&& validator.isValid(finalUrl)) {
			log.info("Browser followed redirect to {}", finalUrl);
			return Optional.of(finalUrl);
		}

		Optional<String> articleLink = href(page, ARTICLE_LINK_SELECTOR);
		if (articleLink.isPresent()) {
			log.info("Found article link: {}", articleLink.get());
			return articleLink;
		}
		for (String selector : ALTERNATIVE_SELECTORS) {
			Optional<String> alternative = href(page, selector);
			if (alternative.isPresent()) {
				log.info("Found alternative link via {}: {}", selector, alternative.get());
				return alternative;
			}
		}
		return Optional.empty();
	}

	private Optional<String> href(BrowserPage page, String selector) {
		try {
			return page.firstHref(selector).filter(validator::isValid);
		} catch (RuntimeException e) {
			log.debug("Selector {} failed: {}", selector, e.getMessage());
			return Optional.empty();
		}
	}
}
