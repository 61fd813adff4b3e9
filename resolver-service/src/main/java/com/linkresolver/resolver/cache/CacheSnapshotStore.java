package com.linkresolver.resolver.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linkresolver.resolver.constants.ResolverConstants;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes the cache snapshot file.
 * Failures never propagate: a missing file is a cold start, anything else is logged and ignored.
 */
@Slf4j
public class CacheSnapshotStore {

	private final Path file;
	private final ObjectMapper objectMapper;

	public CacheSnapshotStore(Path file, ObjectMapper objectMapper) {
		this.file = file;
		this.objectMapper = objectMapper;
	}

	public Optional<CacheSnapshot> load() {
		if (!Files.exists(file)) {
			log.debug("No cache snapshot at {}, starting cold", file);
			return Optional.empty();
		}
		try {
			CacheSnapshot snapshot = objectMapper.readValue(file.toFile(), CacheSnapshot.class);
			if (snapshot == null) {
				log.warn("Cache snapshot {} is empty, starting with an empty cache", file);
				return Optional.empty();
			}
			return Optional.of(snapshot);
		} catch (IOException e) {
			log.warn("Failed to load cache snapshot from {}: {}", file, e.getMessage());
			return Optional.empty();
		}
	}

	/**
	 * Writes through a temporary file so readers never observe a half-written snapshot.
	 *
	 * @return true if the snapshot was written
	 */
	public boolean save(CacheSnapshot snapshot) {
		try {
			Path parent = file.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), snapshot);
			try {
				Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			} catch (AtomicMoveNotSupportedException e) {
				Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
			}
			log.debug("Saved {} cached URL resolutions to {}", snapshot.getEntries().size(), file);
			return true;
		} catch (IOException e) {
			log.warn("Failed to save cache snapshot to {}: {}", file, e.getMessage());
			return false;
		}
	}

	public void delete() {
		try {
			Files.deleteIfExists(file);
		} catch (IOException e) {
			log.warn("Failed to delete cache snapshot {}: {}", file, e.getMessage());
		}
	}

	public Path getFile() {
		return file;
	}

	public static CacheSnapshot toSnapshot(List<CacheEntry> entries, long requestCount, long successCount, Instant now) {
		Map<String, CacheSnapshot.Entry> serialized = new LinkedHashMap<>();
		for (CacheEntry entry : entries) {
			serialized.put(entry.originalKey(), CacheSnapshot.Entry.builder()
				.resolvedUrl(entry.resolvedUrl())
				.timestamp(entry.createdAt().toEpochMilli())
				.requestCount(entry.hitCount())
				.build());
		}
		return CacheSnapshot.builder()
			.version(ResolverConstants.SNAPSHOT_VERSION)
			.timestamp(now.toEpochMilli())
			.stats(CacheSnapshot.Stats.builder()
				.requestCount(requestCount)
				.successCount(successCount)
				.cacheSize(entries.size())
				.build())
			.entries(serialized)
			.build();
	}

	/**
	 * Entries without a resolved URL are skipped.
	 */
	public static List<CacheEntry> toEntries(CacheSnapshot snapshot) {
		List<CacheEntry> result = new ArrayList<>();
		if (snapshot.getEntries() == null) {
			return result;
		}
		snapshot.getEntries().forEach((key, value) -> {
			if (key != null && value != null && value.getResolvedUrl() != null) {
				result.add(new CacheEntry(key, value.getResolvedUrl(),
					Instant.ofEpochMilli(value.getTimestamp()), value.getRequestCount()));
			}
		});
		return result;
	}
}
