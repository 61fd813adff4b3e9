package com.linkresolver.common.exception;

import java.util.Set;

/**
 * Non-2xx answer from an upstream host.
 * Classifies the status so callers can decide between rotating the proxy, retrying, or giving up.
 */
public class UpstreamHttpException extends ExternalApiException {
	
	private static final Set<Integer> BLOCKED_STATUSES = Set.of(403, 407, 429, 502, 503);
	private static final Set<Integer> PERMANENT_STATUSES = Set.of(400, 404);
	
	private final int statusCode;
	
	public UpstreamHttpException(int statusCode, String message) {
		super(message);
		this.statusCode = statusCode;
	}
	
	public UpstreamHttpException(int statusCode, String message, Throwable cause) {
		super(message, cause);
		this.statusCode = statusCode;
	}
	
	public int getStatusCode() {
		return statusCode;
	}
	
	/**
	 * Rate limiting, anti-bot blocking or a refused proxy: the proxy should be reported and rotated.
	 */
	public boolean isBlocked() {
		return BLOCKED_STATUSES.contains(statusCode);
	}
	
	/**
	 * Malformed request or unknown resource: retrying the same call cannot succeed.
	 */
	public boolean isPermanent() {
		return PERMANENT_STATUSES.contains(statusCode);
	}
}
