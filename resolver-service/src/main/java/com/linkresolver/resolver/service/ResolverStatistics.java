package com.linkresolver.resolver.service;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Lifetime counters of the resolver. Request and success counts survive restarts through the cache snapshot.
 */
public class ResolverStatistics {

	private final AtomicLong requestCount = new AtomicLong();
	private final AtomicLong successCount = new AtomicLong();
	private final AtomicLong cacheHits = new AtomicLong();
	private final AtomicLong unresolvedCount = new AtomicLong();

	public long onRequest() {
		return requestCount.incrementAndGet();
	}

	public void onSuccess() {
		successCount.incrementAndGet();
	}

	public void onCacheHit() {
		cacheHits.incrementAndGet();
	}

	public void onUnresolved() {
		unresolvedCount.incrementAndGet();
	}

	public void restore(long requests, long successes) {
		requestCount.set(Math.max(0, requests));
		successCount.set(Math.max(0, successes));
	}

	public long getRequestCount() {
		return requestCount.get();
	}

	public long getSuccessCount() {
		return successCount.get();
	}

	public long getCacheHits() {
		return cacheHits.get();
	}

	public long getUnresolvedCount() {
		return unresolvedCount.get();
	}

	/**
	 * Successful resolutions as a percentage of all requests, 0 when there were none.
	 */
	public double successRate() {
		long requests = requestCount.get();
		return requests == 0 ? 0.0 : successCount.get() * 100.0 / requests;
	}
}
