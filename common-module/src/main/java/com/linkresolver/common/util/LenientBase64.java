package com.linkresolver.common.util;

import org.apache.commons.lang3.StringUtils;

import java.util.Base64;

/**
 * Forgiving Base64 decoding for identifiers lifted out of URLs.
 * Accepts both the standard and the URL-safe alphabet, missing padding and stray characters.
 */
public final class LenientBase64 {

    private LenientBase64() {
        // utility
    }

    /**
     * Decodes with the standard alphabet only; URL-safe characters are dropped as noise.
     *
     * @return decoded bytes, or an empty array when nothing decodable remains
     */
    public static byte[] decodeStandard(String encoded) {
        return decodeNormalized(keepAlphabet(encoded, false));
    }

    /**
     * Maps the URL-safe alphabet ('-', '_') onto the standard one before decoding.
     *
     * @return decoded bytes, or an empty array when nothing decodable remains
     */
    public static byte[] decodeUrlSafe(String encoded) {
        return decodeNormalized(keepAlphabet(encoded, true));
    }

    private static String keepAlphabet(String encoded, boolean urlSafe) {
        if (StringUtils.isEmpty(encoded)) {
            return "";
        }
        StringBuilder sb = new StringBuilder(encoded.length());
        for (int i = 0; i < encoded.length(); i++) {
            char c = encoded.charAt(i);
            if (c == '=') {
                break;
            }
            if (urlSafe && c == '-') {
                sb.append('+');
            } else if (urlSafe && c == '_') {
                sb.append('/');
            } else if (isStandardAlphabet(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static byte[] decodeNormalized(String normalized) {
        String body = normalized;
        // a single dangling sextet cannot form a byte
        if (body.length() % 4 == 1) {
            body = body.substring(0, body.length() - 1);
        }
        if (body.isEmpty()) {
            return new byte[0];
        }
        String padded = body + "=".repeat((4 - body.length() % 4) % 4);
        return Base64.getDecoder().decode(padded);
    }

    private static boolean isStandardAlphabet(char c) {
        return (c >= 'A' && c <= 'Z')
                || (c >= 'a' && c <= 'z')
                || (c >= '0' && c <= '9')
                || c == '+'
                || c == '/';
    }
}
