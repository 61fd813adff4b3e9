package com.linkresolver.resolver.cache;

import java.time.Instant;

/**
 * A successful resolution. Never updated on read; replaced wholesale on re-insert.
 *
 * @param hitCount value of the resolver request counter when the entry was created
 */
public record CacheEntry(String originalKey, String resolvedUrl, Instant createdAt, long hitCount) {
}
