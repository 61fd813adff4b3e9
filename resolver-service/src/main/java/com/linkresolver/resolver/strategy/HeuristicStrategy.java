package com.linkresolver.resolver.strategy;

import com.linkresolver.resolver.decoder.HeuristicExtractor;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

@RequiredArgsConstructor
public class HeuristicStrategy implements ResolutionStrategy {

	public static final String NAME = "heuristic";

	private final HeuristicExtractor extractor;

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public Optional<String> attempt(ResolutionAttemptContext context) {
		return Optional.ofNullable(extractor.extract(context.getRequestUrl()));
	}
}
