package com.linkresolver.resolver.browser;

import java.time.Duration;
import java.util.Optional;

/**
 * Minimal view of a headless-browser tab supplied by the caller.
 * Implementations may throw unchecked exceptions; the resolver treats any of them as a failed attempt.
 */
public interface BrowserPage {

    /**
     * Navigates and waits for the DOM to load.
     *
     * @return false if navigation produced no response
     */
    boolean goTo(String url, Duration timeout);

    void waitFor(Duration duration);

    /**
     * Current URL, after any redirects.
     */
    String url();

    /**
     * Href of the first element matching the CSS selector (falling back to its raw {@code href} attribute).
     */
    Optional<String> firstHref(String selector);
}
