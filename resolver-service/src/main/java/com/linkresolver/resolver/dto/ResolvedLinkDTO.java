package com.linkresolver.resolver.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Result of resolving an aggregator link")
public class ResolvedLinkDTO {

	@Schema(description = "Link as submitted", example = "https://news.google.com/rss/articles/CBMiK2h0dHBzOi8vZXhhbXBsZS5jb20v0gEA")
	private String originalUrl;

	@Schema(description = "Publisher URL, or the original link when it could not be resolved", example = "https://example.com/")
	private String resolvedUrl;

	@Schema(description = "Whether resolvedUrl differs from originalUrl")
	private boolean resolved;
}
