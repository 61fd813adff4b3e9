package com.linkresolver.resolver.client;

/**
 * Short-lived authorization for one batch decode call. Never cached.
 */
public record SigningParams(String articleId, String signature, long timestamp, RequestProfile strategyUsed) {
}
