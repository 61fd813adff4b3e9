package com.linkresolver.resolver.service;

import com.linkresolver.common.validation.ResolvedUrlValidator;
import com.linkresolver.resolver.browser.BrowserPage;
import com.linkresolver.resolver.cache.CacheSnapshot;
import com.linkresolver.resolver.cache.CacheSnapshotStore;
import com.linkresolver.resolver.cache.CacheStats;
import com.linkresolver.resolver.cache.ResolutionCache;
import com.linkresolver.resolver.config.CostEnvironment;
import com.linkresolver.resolver.dto.ResolverStatsDTO;
import com.linkresolver.resolver.metrics.ResolutionMetrics;
import com.linkresolver.resolver.proxy.ProxyProvider;
import com.linkresolver.resolver.ratelimit.MinIntervalRateLimiter;
import com.linkresolver.resolver.strategy.ResolutionAttemptContext;
import com.linkresolver.resolver.strategy.ResolutionStrategy;
import jakarta.annotation.PreDestroy;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Public entry point for resolving aggregator links to publisher URLs.
 *
 * <p>Flow per call: links outside the aggregator are returned as-is, cached resolutions are returned
 * without any outbound call, otherwise the rate limiter is honoured and the strategies run in their
 * configured order until one yields an acceptable URL, which is then cached.
 *
 * <p>{@link #resolveUrl(String, BrowserPage)} never throws. When nothing works the input comes back
 * unchanged and callers proceed with the aggregator link.
 */
@Slf4j
public class LinkResolutionService {

	private final ResolutionCache cache;
	private final MinIntervalRateLimiter rateLimiter;
	private final List<ResolutionStrategy> strategies;
	private final ProxyProvider proxyProvider;
	private final ResolvedUrlValidator validator;
	private final String aggregatorHost;
	private final CostEnvironment environment;
	private final ResolverStatistics statistics;
	private final ResolutionMetrics metrics;
	private final CacheSnapshotStore snapshotStore;
	private final CachePersistenceJob persistenceJob;
	private final Clock clock;

	private final AtomicBoolean initialized = new AtomicBoolean();
	private final AtomicBoolean cleanedUp = new AtomicBoolean();

	/**
	 * @param snapshotStore null when persistence is disabled
	 * @param persistenceJob null when persistence is disabled
	 */
	@Builder
	public LinkResolutionService(@NonNull ResolutionCache cache,
	                             @NonNull MinIntervalRateLimiter rateLimiter,
	                             @NonNull List<ResolutionStrategy> strategies,
	                             @NonNull ProxyProvider proxyProvider,
	                             @NonNull ResolvedUrlValidator validator,
	                             @NonNull String aggregatorHost,
	                             @NonNull CostEnvironment environment,
	                             @NonNull ResolverStatistics statistics,
	                             @NonNull ResolutionMetrics metrics,
	                             CacheSnapshotStore snapshotStore,
	                             CachePersistenceJob persistenceJob,
	                             @NonNull Clock clock) {
		this.cache = cache;
		this.rateLimiter = rateLimiter;
		this.strategies = List.copyOf(strategies);
		this.proxyProvider = proxyProvider;
		this.validator = validator;
		this.aggregatorHost = aggregatorHost.toLowerCase(Locale.ROOT);
		this.environment = environment;
		this.statistics = statistics;
		this.metrics = metrics;
		this.snapshotStore = snapshotStore;
		this.persistenceJob = persistenceJob;
		this.clock = clock;
	}

	/**
	 * Loads the persisted cache and starts the periodic save. Safe to call more than once.
	 */
	public void initialize() {
		if (!initialized.compareAndSet(false, true)) {
			return;
		}
		log.info("Link resolver starting in {} environment with strategies {}", environment,
			strategies.stream().map(ResolutionStrategy::name).toList());
		if (snapshotStore == null) {
			return;
		}
		snapshotStore.load().ifPresent(this::restore);
		if (persistenceJob != null) {
			persistenceJob.start(this::persistCache);
		}
	}

	public String resolveUrl(String url) {
		return resolveUrl(url, null);
	}

	/**
	 * @param url aggregator link (or any link; non-aggregator links are returned unchanged)
	 * @param browserPage optional browser tab enabling the browser strategy
	 * @return the publisher URL, or {@code url} itself when it could not be resolved
	 */
	public String resolveUrl(String url, BrowserPage browserPage) {
		try {
			return metrics.recordLatency(() -> doResolve(url, browserPage));
		} catch (RuntimeException e) {
			metrics.onError();
			log.error("Error resolving link {}: {}", url, e.getMessage(), e);
			return url;
		}
	}

	private String doResolve(String url, BrowserPage browserPage) {
		long requestNumber = statistics.onRequest();
		metrics.onRequest();

		if (StringUtils.isBlank(url) || !url.toLowerCase(Locale.ROOT).contains(aggregatorHost)) {
			return url;
		}

		Optional<String> cached = cache.get(url);
		if (cached.isPresent()) {
			statistics.onCacheHit();
			metrics.onCacheHit();
			log.debug("Using cached resolution for {}: {}", url, cached.get());
			return cached.get();
		}

		log.info("Resolving aggregator link ({}): {}", requestNumber, url);
		try {
			rateLimiter.acquire();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			log.warn("Interrupted while waiting for rate limiter, returning {} unresolved", url);
			return url;
		}

		ResolutionAttemptContext context = new ResolutionAttemptContext(url, proxyProvider, browserPage);
		for (ResolutionStrategy strategy : strategies) {
			Optional<String> candidate = attempt(strategy, context);
			if (candidate.isPresent()) {
				String resolved = candidate.get();
				cache.set(url, resolved, requestNumber);
				statistics.onSuccess();
				metrics.onSuccess(strategy.name());
				log.info("Resolved with {}: {}", strategy.name(), resolved);
				return resolved;
			}
		}

		statistics.onUnresolved();
		metrics.onUnresolved();
		log.warn("Could not resolve aggregator link after {}: {}", context.getTriedStrategies(), url);
		return url;
	}

	private Optional<String> attempt(ResolutionStrategy strategy, ResolutionAttemptContext context) {
		if (!strategy.isApplicable(context)) {
			return Optional.empty();
		}
		context.beginAttempt(strategy.name());
		log.debug("Attempt {}: {}", context.getAttemptNumber(), strategy.name());
		try {
			Optional<String> candidate = strategy.attempt(context);
			if (candidate == null || candidate.isEmpty()) {
				log.debug("Strategy {} produced nothing", strategy.name());
				return Optional.empty();
			}
			String value = candidate.get();
			if (value.equals(context.getRequestUrl()) || !validator.isValid(value)) {
				log.debug("Strategy {} produced unacceptable candidate: {}", strategy.name(), value);
				return Optional.empty();
			}
			return candidate;
		} catch (Exception e) {
			log.debug("Strategy {} failed: {}", strategy.name(), e.getMessage());
			return Optional.empty();
		}
	}

	public ResolverStatsDTO stats() {
		CacheStats cacheStats = cache.stats();
		return ResolverStatsDTO.builder()
			.totalEntries(cacheStats.size())
			.validEntries(cacheStats.validCount())
			.expiredEntries(cacheStats.expiredCount())
			.requestCount(statistics.getRequestCount())
			.successCount(statistics.getSuccessCount())
			.cacheHits(statistics.getCacheHits())
			.unresolvedCount(statistics.getUnresolvedCount())
			.successRate(String.format(Locale.ROOT, "%.1f%%", statistics.successRate()))
			.environment(environment.toString())
			.build();
	}

	/**
	 * Empties the cache and removes the snapshot file.
	 */
	public void clearCache() {
		cache.clear();
		if (snapshotStore != null) {
			snapshotStore.delete();
		}
		log.info("Resolution cache cleared");
	}

	/**
	 * Stops the persistence timer and writes one final snapshot. Subsequent calls do nothing.
	 */
	@PreDestroy
	public void cleanup() {
		if (!cleanedUp.compareAndSet(false, true)) {
			return;
		}
		if (persistenceJob != null) {
			persistenceJob.stop();
		}
		persistCache();
		log.info("Link resolver cleanup completed. Final stats: {}", stats());
	}

	/**
	 * Writes the current cache and counters to disk. No-op when persistence is disabled.
	 */
	public void persistCache() {
		if (snapshotStore == null) {
			return;
		}
		CacheSnapshot snapshot = CacheSnapshotStore.toSnapshot(cache.snapshot(),
			statistics.getRequestCount(), statistics.getSuccessCount(), clock.instant());
		snapshotStore.save(snapshot);
	}

	private void restore(CacheSnapshot snapshot) {
		cache.restore(CacheSnapshotStore.toEntries(snapshot));
		if (snapshot.getStats() != null) {
			statistics.restore(snapshot.getStats().getRequestCount(), snapshot.getStats().getSuccessCount());
		}
		log.info("Loaded {} cached link resolutions from {}", cache.size(), snapshotStore.getFile());
	}

	public List<ResolutionStrategy> getStrategies() {
		return strategies;
	}
}
