package com.linkresolver.resolver.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolverStatsDTO {

	private int totalEntries;
	private int validEntries;
	private int expiredEntries;
	private long requestCount;
	private long successCount;
	private long cacheHits;
	private long unresolvedCount;
	private String successRate;
	private String environment;
}
