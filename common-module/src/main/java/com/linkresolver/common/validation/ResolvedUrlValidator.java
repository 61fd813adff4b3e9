package com.linkresolver.common.validation;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;

/**
 * Validator for resolution candidates.
 * A candidate is accepted only when it is a non-blank http(s) URL that does not point back at the aggregator.
 */
@Slf4j
public class ResolvedUrlValidator {

	private static final String HTTP_PREFIX = "http";

	private final String excludedDomain;

	public ResolvedUrlValidator(String excludedDomain) {
		if (StringUtils.isBlank(excludedDomain)) {
			throw new IllegalArgumentException("excludedDomain must not be blank");
		}
		this.excludedDomain = excludedDomain.toLowerCase(Locale.ROOT);
	}

	/**
	 * @param candidate URL produced by a resolution strategy
	 * @return true if the candidate may be returned to callers and cached
	 */
	public boolean isValid(String candidate) {
		return validate(candidate) == null;
	}

	/**
	 * Validates and returns a descriptive message if invalid.
	 *
	 * @param candidate URL produced by a resolution strategy
	 * @return validation error message or null if valid
	 */
	public String validate(String candidate) {
		if (StringUtils.isBlank(candidate)) {
			return "Candidate URL cannot be null or blank";
		}

		if (!candidate.startsWith(HTTP_PREFIX)) {
			return "Candidate URL must start with http";
		}

		if (references(candidate)) {
			log.debug("Rejecting self-referencing candidate: {}", candidate);
			return "Candidate URL references the aggregator domain " + excludedDomain;
		}

		return null;
	}

	/**
	 * Substring match against the excluded domain, case-insensitive.
	 */
	public boolean references(String url) {
		return url != null && url.toLowerCase(Locale.ROOT).contains(excludedDomain);
	}

	public String getExcludedDomain() {
		return excludedDomain;
	}
}
