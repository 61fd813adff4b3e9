package com.linkresolver.common.exception;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UpstreamHttpExceptionTest {

	@Test
	void testIsBlocked_ProxyAuthenticationRequired() {
		UpstreamHttpException ex = new UpstreamHttpException(407, "Proxy refused tunnel");

		assertTrue(ex.isBlocked());
		assertFalse(ex.isPermanent());
	}

	@Test
	void testIsBlocked_RateLimitedAndUnavailable() {
		assertTrue(new UpstreamHttpException(429, "Too many requests").isBlocked());
		assertTrue(new UpstreamHttpException(503, "Unavailable").isBlocked());
	}

	@Test
	void testIsPermanent_NotFound() {
		UpstreamHttpException ex = new UpstreamHttpException(404, "Article not found");

		assertTrue(ex.isPermanent());
		assertFalse(ex.isBlocked());
	}

	@Test
	void testServerError_IsNeitherBlockedNorPermanent() {
		UpstreamHttpException ex = new UpstreamHttpException(500, "Internal error");

		assertFalse(ex.isBlocked());
		assertFalse(ex.isPermanent());
	}
}
