package com.linkresolver.resolver.strategy;

import java.util.Optional;

/**
 * One way of turning an aggregator link into the publisher URL.
 * Implementations must not throw for ordinary failures; they return empty instead.
 */
public interface ResolutionStrategy {

	String name();

	Optional<String> attempt(ResolutionAttemptContext context);

	/**
	 * Strategies that need something the caller did not supply are skipped.
	 */
	default boolean isApplicable(ResolutionAttemptContext context) {
		return true;
	}
}
