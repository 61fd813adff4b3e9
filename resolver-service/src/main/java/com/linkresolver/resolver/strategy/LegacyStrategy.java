package com.linkresolver.resolver.strategy;

import com.linkresolver.resolver.decoder.LegacyDecoder;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

@RequiredArgsConstructor
public class LegacyStrategy implements ResolutionStrategy {

	public static final String NAME = "legacy";

	private final LegacyDecoder decoder;

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public boolean isApplicable(ResolutionAttemptContext context) {
		return context.getIdentifier().isPresent();
	}

	@Override
	public Optional<String> attempt(ResolutionAttemptContext context) {
		return context.getIdentifier().map(decoder::decode);
	}
}
