package com.linkresolver.resolver.strategy;

import com.linkresolver.resolver.browser.BrowserResolver;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

@RequiredArgsConstructor
public class BrowserStrategy implements ResolutionStrategy {

	public static final String NAME = "browser";

	private final BrowserResolver browserResolver;

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public boolean isApplicable(ResolutionAttemptContext context) {
		return context.getBrowserPage().isPresent();
	}

	@Override
	public Optional<String> attempt(ResolutionAttemptContext context) {
		return browserResolver.resolve(context.getRequestUrl(), context.getBrowserPage().orElseThrow());
	}
}
