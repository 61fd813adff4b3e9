package com.linkresolver.resolver.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * On-disk form of the resolution cache. Timestamps are epoch milliseconds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheSnapshot {

	private String version;
	private long timestamp;
	private Stats stats;

	@Builder.Default
	private Map<String, Entry> entries = new LinkedHashMap<>();

	@Data
	@Builder
	@NoArgsConstructor
	@AllArgsConstructor
	public static class Stats {
		private long requestCount;
		private long successCount;
		private int cacheSize;
	}

	@Data
	@Builder
	@NoArgsConstructor
	@AllArgsConstructor
	public static class Entry {
		private String resolvedUrl;
		private long timestamp;
		private long requestCount;
	}
}
