package com.linkresolver.resolver.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory store of resolved links with lazy TTL expiry and FIFO eviction.
 *
 * <p>Eviction follows insertion order only; reads never reorder entries.
 * All operations on the backing map run under one lock, so get/set/evict
 * are atomic with respect to each other.
 */
@Slf4j
public class ResolutionCache {

	private final Map<String, CacheEntry> entries = new LinkedHashMap<>();
	private final ReentrantLock lock = new ReentrantLock();

	private final Duration ttl;
	private final int maxSize;
	private final Clock clock;

	public ResolutionCache(Duration ttl, int maxSize, Clock clock) {
		if (ttl == null || ttl.isNegative() || ttl.isZero()) {
			throw new IllegalArgumentException("ttl must be positive");
		}
		if (maxSize < 1) {
			throw new IllegalArgumentException("maxSize must be at least 1");
		}
		this.ttl = ttl;
		this.maxSize = maxSize;
		this.clock = clock;
	}

	/**
	 * Returns the resolved URL if present and not expired. An expired entry is removed.
	 */
	public Optional<String> get(String key) {
		if (key == null) {
			return Optional.empty();
		}
		lock.lock();
		try {
			CacheEntry entry = entries.get(key);
			if (entry == null) {
				return Optional.empty();
			}
			if (isExpired(entry, clock.instant())) {
				entries.remove(key);
				log.debug("Cache entry expired for: {}", key);
				return Optional.empty();
			}
			return Optional.of(entry.resolvedUrl());
		} finally {
			lock.unlock();
		}
	}

	public void set(String key, String resolvedUrl) {
		set(key, resolvedUrl, 0L);
	}

	/**
	 * Inserts or replaces an entry. A new key at capacity evicts the oldest inserted entry first.
	 */
	public void set(String key, String resolvedUrl, long hitCount) {
		if (key == null || resolvedUrl == null) {
			throw new IllegalArgumentException("key and resolvedUrl must not be null");
		}
		lock.lock();
		try {
			if (!entries.containsKey(key) && entries.size() >= maxSize) {
				evictOldest();
			}
			entries.put(key, new CacheEntry(key, resolvedUrl, clock.instant(), hitCount));
		} finally {
			lock.unlock();
		}
	}

	public CacheStats stats() {
		lock.lock();
		try {
			Instant now = clock.instant();
			int expired = 0;
			for (CacheEntry entry : entries.values()) {
				if (isExpired(entry, now)) {
					expired++;
				}
			}
			return new CacheStats(entries.size(), entries.size() - expired, expired);
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Copy of all entries in insertion order, for persistence.
	 */
	public List<CacheEntry> snapshot() {
		lock.lock();
		try {
			return new ArrayList<>(entries.values());
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Loads previously persisted entries, keeping their original timestamps.
	 * Entries beyond capacity push out the oldest ones as usual.
	 */
	public void restore(Collection<CacheEntry> restored) {
		lock.lock();
		try {
			for (CacheEntry entry : restored) {
				if (!entries.containsKey(entry.originalKey()) && entries.size() >= maxSize) {
					evictOldest();
				}
				entries.put(entry.originalKey(), entry);
			}
		} finally {
			lock.unlock();
		}
	}

	public void clear() {
		lock.lock();
		try {
			entries.clear();
		} finally {
			lock.unlock();
		}
	}

	public int size() {
		lock.lock();
		try {
			return entries.size();
		} finally {
			lock.unlock();
		}
	}

	private void evictOldest() {
		Iterator<String> it = entries.keySet().iterator();
		if (it.hasNext()) {
			String oldestKey = it.next();
			it.remove();
			log.debug("Cache size limit reached, removed oldest entry: {}", oldestKey);
		}
	}

	private boolean isExpired(CacheEntry entry, Instant now) {
		return Duration.between(entry.createdAt(), now).compareTo(ttl) > 0;
	}
}
