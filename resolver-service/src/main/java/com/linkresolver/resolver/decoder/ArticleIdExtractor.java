package com.linkresolver.resolver.decoder;

import com.linkresolver.resolver.constants.ResolverConstants;
import org.apache.commons.lang3.StringUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Optional;

/**
 * Pulls the opaque identifier out of an aggregator link: the last path segment when the one before it is
 * {@code articles}.
 */
public final class ArticleIdExtractor {

    private ArticleIdExtractor() {
        // utility
    }

    public static Optional<String> extract(String link) {
        if (StringUtils.isBlank(link)) {
            return Optional.empty();
        }
        String path;
        try {
            path = new URI(link.trim()).getRawPath();
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
        if (path == null) {
            return Optional.empty();
        }
        String[] parts = path.split("/", -1);
        if (parts.length < 2 || !ResolverConstants.ARTICLES_SEGMENT.equals(parts[parts.length - 2])) {
            return Optional.empty();
        }
        String id = parts[parts.length - 1];
        return id.isEmpty() ? Optional.empty() : Optional.of(id);
    }
}
