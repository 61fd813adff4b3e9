package com.linkresolver.resolver.decoder;

import com.linkresolver.common.util.LenientBase64;
import com.linkresolver.common.validation.ResolvedUrlValidator;
import com.linkresolver.resolver.constants.ResolverConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cheap offline guesses at the target URL. False negatives are fine; anything pointing back at the
 * aggregator is filtered out.
 */
@Slf4j
@RequiredArgsConstructor
public class HeuristicExtractor {

    private static final List<String> REDIRECT_PARAMS = List.of("url", "u", "link", "target", "redirect");

    private static final Pattern EMBEDDED_URL = Pattern.compile("https?://[^\\s\"'<>\\x00-\\x1f\\x7f\\x{fffd}]+");

    private static final List<Pattern> RAW_PATTERNS = List.of(
            Pattern.compile("https?://[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}[^\\s\"'<>]*"),
            afterMarker(ResolverConstants.LEGACY_FORMAT_MARKER),
            afterMarker(ResolverConstants.CURRENT_FORMAT_MARKER)
    );

    private final ResolvedUrlValidator validator;

    /**
     * A URL following a format marker and a run of Base64 characters; group 1 is the URL.
     */
    static Pattern afterMarker(String marker) {
        return Pattern.compile(Pattern.quote(marker) + "[a-zA-Z0-9+/=]*?(https?://[^\\s\"'<>]+)");
    }

    /**
     * @param identifierOrUrl an aggregator link or a bare identifier
     * @return first acceptable candidate, or null
     */
    public String extract(String identifierOrUrl) {
        if (StringUtils.isBlank(identifierOrUrl)) {
            return null;
        }
        String identifier = ArticleIdExtractor.extract(identifierOrUrl).orElse(identifierOrUrl);

        List<Function<String, String>> steps = List.of(
                ignored -> fromQueryParams(identifierOrUrl),
                id -> firstEmbeddedUrl(LenientBase64.decodeStandard(id)),
                id -> firstEmbeddedUrl(LenientBase64.decodeUrlSafe(id)),
                this::fromRawPatterns
        );
        for (Function<String, String> step : steps) {
            String candidate = step.apply(identifier);
            if (candidate != null && validator.isValid(candidate)) {
                log.debug("Heuristic extraction found {}", candidate);
                return candidate;
            }
        }
        return null;
    }

    String fromQueryParams(String link) {
        if (!link.contains("?")) {
            return null;
        }
        try {
            var params = UriComponentsBuilder.fromUriString(link).build().getQueryParams();
            for (String name : REDIRECT_PARAMS) {
                String raw = params.getFirst(name);
                if (raw == null) {
                    continue;
                }
                String value = URLDecoder.decode(raw, StandardCharsets.UTF_8);
                if (validator.isValid(value)) {
                    return value;
                }
            }
        } catch (IllegalArgumentException e) {
            log.debug("Could not read query parameters of {}: {}", link, e.getMessage());
        }
        return null;
    }

    private String firstEmbeddedUrl(byte[] decoded) {
        if (decoded.length == 0) {
            return null;
        }
        Matcher matcher = EMBEDDED_URL.matcher(new String(decoded, StandardCharsets.UTF_8));
        while (matcher.find()) {
            if (validator.isValid(matcher.group())) {
                return matcher.group();
            }
        }
        return null;
    }

    private String fromRawPatterns(String identifier) {
        for (Pattern pattern : RAW_PATTERNS) {
            Matcher matcher = pattern.matcher(identifier);
            while (matcher.find()) {
                String match = matcher.groupCount() > 0 ? matcher.group(1) : matcher.group();
                if (validator.isValid(match)) {
                    return match;
                }
            }
        }
        return null;
    }
}
