package com.linkresolver.resolver.controller;

import com.linkresolver.common.exception.RateLimitExceededException;
import com.linkresolver.resolver.dto.ResolvedLinkDTO;
import com.linkresolver.resolver.dto.ResolverStatsDTO;
import com.linkresolver.resolver.service.LinkResolutionService;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Objects;

@RestController
@RequestMapping("/api/links")
@Slf4j
@RequiredArgsConstructor
@Validated
@Tag(name = "Links", description = "Resolve aggregator redirect links to publisher article URLs")
public class LinkResolutionController {
	
	private final LinkResolutionService linkResolutionService;
	
	@GetMapping("/resolve")
	@RateLimiter(name = "linkResolver", fallbackMethod = "resolveRateLimitFallback")
	@Operation(
		summary = "Resolve an aggregator link",
		description = "Returns the publisher URL behind an aggregator link. Unresolvable links come back unchanged " +
			"with resolved=false; this is not an error."
	)
	@ApiResponses(value = {
		@ApiResponse(
			responseCode = "200",
			description = "Resolution finished",
			content = @Content(schema = @Schema(implementation = ResolvedLinkDTO.class))
		),
		@ApiResponse(
			responseCode = "400",
			description = "Missing or invalid url parameter"
		),
		@ApiResponse(
			responseCode = "429",
			description = "Rate limit exceeded"
		)
	})
	public ResponseEntity<ResolvedLinkDTO> resolve(
		@Parameter(description = "Aggregator link to resolve", required = true)
		@RequestParam
		@NotBlank(message = "url must not be blank")
		@Size(max = 4096, message = "url cannot exceed 4096 characters")
		String url) {
		
		log.debug("Resolving link via API: {}", url);
		String resolved = linkResolutionService.resolveUrl(url);
		return ResponseEntity.ok(ResolvedLinkDTO.builder()
			.originalUrl(url)
			.resolvedUrl(resolved)
			.resolved(!Objects.equals(url, resolved))
			.build());
	}
	
	@GetMapping("/stats")
	@Operation(summary = "Resolver statistics", description = "Cache sizes, request and success counters")
	public ResponseEntity<ResolverStatsDTO> stats() {
		return ResponseEntity.ok(linkResolutionService.stats());
	}
	
	@DeleteMapping("/cache")
	@Operation(summary = "Clear the resolution cache", description = "Empties the cache and deletes its snapshot file")
	public ResponseEntity<Void> clearCache() {
		linkResolutionService.clearCache();
		return ResponseEntity.noContent().build();
	}
	
	/**
	 * Fallback method for rate limit exceeded on resolve endpoint. Answered as 429 by the exception handler.
	 */
	@SuppressWarnings("unused")
	private ResponseEntity<ResolvedLinkDTO> resolveRateLimitFallback(String url, RequestNotPermitted e) {
		log.warn("Rate limit exceeded for resolve. url={}", url);
		throw new RateLimitExceededException("Too many resolve requests, retry later", e);
	}
}
