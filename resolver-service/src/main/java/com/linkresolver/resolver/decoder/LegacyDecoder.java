package com.linkresolver.resolver.decoder;

import com.linkresolver.common.util.LenientBase64;
import com.linkresolver.common.validation.ResolvedUrlValidator;
import com.linkresolver.resolver.constants.ResolverConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Offline decoder for old-style identifiers, which are base64 over a small protobuf message
 * whose string field holds the article URL:
 * {@code 08 13 22 <varint length> <url bytes> d2 01 00}.
 */
@Slf4j
@RequiredArgsConstructor
public class LegacyDecoder {

    private static final byte[] PREFIX = {0x08, 0x13, 0x22};
    private static final byte[] SUFFIX = {(byte) 0xd2, 0x01, 0x00};

    private final ResolvedUrlValidator validator;

    /**
     * @return the embedded URL, or null if the identifier is current-format or does not decode to a usable URL
     */
    public String decode(String identifier) {
        if (StringUtils.isBlank(identifier)) {
            return null;
        }
        if (identifier.startsWith(ResolverConstants.CURRENT_FORMAT_MARKER)) {
            log.debug("Current-format identifier, legacy decoding not applicable");
            return null;
        }

        byte[] bytes = LenientBase64.decodeUrlSafe(identifier);
        int from = startsWith(bytes, PREFIX) ? PREFIX.length : 0;
        int to = endsWith(bytes, SUFFIX) && bytes.length - SUFFIX.length >= from
                ? bytes.length - SUFFIX.length
                : bytes.length;
        if (from >= to) {
            return null;
        }

        byte[] field = Arrays.copyOfRange(bytes, from, to);
        String candidate = readLengthPrefixed(field);
        if (candidate == null || !validator.isValid(candidate)) {
            return null;
        }
        log.debug("Decoded legacy identifier to {}", candidate);
        return candidate;
    }

    /**
     * Reads a varint length followed by that many bytes, clamped to what is available.
     */
    static String readLengthPrefixed(byte[] field) {
        long length = 0;
        int shift = 0;
        int pos = 0;
        while (pos < field.length && shift < 35) {
            int b = field[pos++] & 0xff;
            length |= (long) (b & 0x7f) << shift;
            if ((b & 0x80) == 0) {
                int end = (int) Math.min(field.length, pos + length);
                return end > pos ? new String(field, pos, end - pos, StandardCharsets.UTF_8) : null;
            }
            shift += 7;
        }
        return null;
    }

    private static boolean startsWith(byte[] bytes, byte[] prefix) {
        if (bytes.length < prefix.length) {
            return false;
        }
        return Arrays.equals(bytes, 0, prefix.length, prefix, 0, prefix.length);
    }

    private static boolean endsWith(byte[] bytes, byte[] suffix) {
        if (bytes.length < suffix.length) {
            return false;
        }
        return Arrays.equals(bytes, bytes.length - suffix.length, bytes.length, suffix, 0, suffix.length);
    }
}
