package com.linkresolver.resolver.cache;

public record CacheStats(int size, int validCount, int expiredCount) {
}
