package com.linkresolver.resolver.client;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Percent-encoding identical to what browsers produce for a URI component:
 * only {@code A-Z a-z 0-9 - _ . ! ~ * ' ( )} stay literal and a space becomes {@code %20}.
 */
final class FormComponentEncoder {

    private FormComponentEncoder() {
        // utility
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("%21", "!")
                .replace("%27", "'")
                .replace("%28", "(")
                .replace("%29", ")")
                .replace("%7E", "~");
    }
}
